package me.golemcore.nsla.adapter.outbound.proposer;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.nsla.domain.model.Feedback;
import me.golemcore.nsla.domain.model.IssueKind;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.ProposalContext;
import me.golemcore.nsla.domain.model.StructuralException;
import me.golemcore.nsla.domain.model.ValidationIssue;
import me.golemcore.nsla.domain.service.ProgramJsonCodec;
import me.golemcore.nsla.infrastructure.config.NslaProperties;
import me.golemcore.nsla.testsupport.Programs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jProposerAdapterTest {

    private static final String OPENAI = "openai";

    private NslaProperties properties;
    private ProgramJsonCodec codec;
    private ChatModel chatModel;
    private List<List<ChatMessage>> sentMessages;
    private Langchain4jProposerAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new NslaProperties();
        codec = Programs.codec();
        chatModel = mock(ChatModel.class);
        sentMessages = new ArrayList<>();
        adapter = new Langchain4jProposerAdapter(properties, codec, chatModel);
    }

    @SuppressWarnings("unchecked")
    private void modelReplies(String... replies) {
        int[] call = { 0 };
        when(chatModel.chat(anyList())).thenAnswer(invocation -> {
            sentMessages.add(new ArrayList<>((List<ChatMessage>) invocation.getArgument(0)));
            String text = replies[Math.min(call[0]++, replies.length - 1)];
            return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
        });
    }

    private String fenced(Program program) {
        return "Here is the refined program:\n```json\n" + codec.write(program) + "\n```";
    }

    private static Program withoutRules() {
        return Programs.contractualLiabilityBuilder().rules(List.of()).build();
    }

    private static ProposalContext contextWithMissingLink() {
        return ProposalContext.builder()
                .sessionId("s-1")
                .question("Is the debtor liable?")
                .priorProgram(Programs.contractualLiability())
                .priorFeedback(Feedback.noEntailment(List.of("NessoCausale"), "Query not entailed"))
                .historySummary("iter 0: consistent_no_entailment missing=[NessoCausale]")
                .build();
    }

    private static String userText(List<ChatMessage> messages) {
        return ((UserMessage) messages.get(1)).singleText();
    }

    // ===== Provider =====

    @Test
    void shouldReturnLangchain4jProviderId() {
        assertEquals("langchain4j", adapter.getProviderId());
    }

    @Test
    void shouldBeAvailableWhenApiKeyConfigured() {
        NslaProperties.ProviderProperties provider = new NslaProperties.ProviderProperties();
        provider.setApiKey("sk-test");
        properties.getProposer().getLangchain4j().getProviders().put(OPENAI, provider);

        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldNotBeAvailableWhenApiKeyBlank() {
        NslaProperties.ProviderProperties provider = new NslaProperties.ProviderProperties();
        provider.setApiKey("  ");
        properties.getProposer().getLangchain4j().getProviders().put(OPENAI, provider);

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailProposalWhenProviderNotConfigured() {
        Langchain4jProposerAdapter unconfigured = new Langchain4jProposerAdapter(properties, codec);

        CompletionException error = assertThrows(CompletionException.class,
                () -> unconfigured.propose(contextWithMissingLink()).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    // ===== propose() =====

    @Test
    void shouldReturnProgramCoveringMissingLinks() {
        modelReplies(fenced(Programs.contractualLiabilityWithCausalLink()));

        Program proposed = adapter.propose(contextWithMissingLink()).join();

        assertEquals(Programs.contractualLiabilityWithCausalLink(), proposed);
        assertEquals(1, sentMessages.size());
        assertInstanceOf(SystemMessage.class, sentMessages.get(0).get(0));
    }

    @Test
    void shouldAskAgainWhenMissingLinkIsIgnored() {
        modelReplies(fenced(withoutRules()), fenced(Programs.contractualLiabilityWithCausalLink()));

        Program proposed = adapter.propose(contextWithMissingLink()).join();

        assertEquals(Programs.contractualLiabilityWithCausalLink(), proposed);
        assertEquals(2, sentMessages.size());
        assertFalse(userText(sentMessages.get(0)).contains("## Attention"));
        assertTrue(userText(sentMessages.get(1)).contains("missing_links (NessoCausale)"));
    }

    @Test
    void shouldReturnLastProgramWhenAttemptsRunOut() {
        modelReplies(fenced(withoutRules()));

        Program proposed = adapter.propose(contextWithMissingLink()).join();

        assertEquals(withoutRules(), proposed);
        assertEquals(2, sentMessages.size());
    }

    @Test
    void shouldRecoverFromUnusableReply() {
        modelReplies("I cannot help with that.", fenced(Programs.contractualLiabilityWithCausalLink()));

        Program proposed = adapter.propose(contextWithMissingLink()).join();

        assertEquals(Programs.contractualLiabilityWithCausalLink(), proposed);
        assertTrue(userText(sentMessages.get(1)).contains("not a valid program"));
    }

    @Test
    void shouldFailWhenEveryReplyIsUnusable() {
        modelReplies("{\"rules\": []}");

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.propose(contextWithMissingLink()).join());

        assertInstanceOf(StructuralException.class, error.getCause());
    }

    // ===== Prompt =====

    @Test
    void shouldBuildPromptWithAllSections() {
        ProposalContext context = contextWithMissingLink().toBuilder()
                .guardrailIssues(List.of(new ValidationIssue(IssueKind.UNDECLARED_PREDICATE, "rule r1",
                        "predicate 'Colpa' is not declared")))
                .compileError("Formula does not parse")
                .attempt(2)
                .build();

        String prompt = adapter.buildPrompt(context, "Add NessoCausale");

        assertTrue(prompt.contains("## Question\nIs the debtor liable?"));
        assertTrue(prompt.contains("## Current program\n{"));
        assertTrue(prompt.contains("status: consistent_no_entailment"));
        assertTrue(prompt.contains("missing_links: [NessoCausale]"));
        assertTrue(prompt.contains("## Guardrail issues to fix"));
        assertTrue(prompt.contains("Colpa"));
        assertTrue(prompt.contains("## Compilation error\nFormula does not parse"));
        assertTrue(prompt.contains("## History\niter 0"));
        assertTrue(prompt.contains("## Attention\nAdd NessoCausale"));
        assertTrue(prompt.endsWith("Return the refined program as JSON only."));
    }

    @Test
    void shouldOmitEmptySections() {
        String prompt = adapter.buildPrompt(ProposalContext.builder().build(), null);

        assertEquals("Return the refined program as JSON only.", prompt);
    }

    // ===== Helpers =====

    @Test
    void shouldExtractFencedJson() {
        assertEquals("{\"a\": 1}", Langchain4jProposerAdapter.extractJson("text\n```json\n{\"a\": 1}\n```\nmore"));
    }

    @Test
    void shouldExtractBareJson() {
        assertEquals("{\"a\": {\"b\": 2}}",
                Langchain4jProposerAdapter.extractJson("Sure: {\"a\": {\"b\": 2}} done"));
    }

    @Test
    void shouldRejectReplyWithoutJson() {
        assertThrows(StructuralException.class, () -> Langchain4jProposerAdapter.extractJson("no json here"));
        assertThrows(StructuralException.class, () -> Langchain4jProposerAdapter.extractJson("  "));
        assertThrows(StructuralException.class, () -> Langchain4jProposerAdapter.extractJson(null));
    }

    @Test
    void shouldCheckMissingLinkCoverage() {
        Program linked = Programs.contractualLiabilityWithCausalLink();

        assertTrue(Langchain4jProposerAdapter.coversMissingLinks(linked, List.of()));
        assertTrue(Langchain4jProposerAdapter.coversMissingLinks(linked, List.of("nessocausale")));
        assertFalse(Langchain4jProposerAdapter.coversMissingLinks(linked, List.of("Colpa")));
    }

    @Test
    void shouldSortPredicatesInRetryHint() {
        String hint = Langchain4jProposerAdapter.buildRetryHint(List.of("NessoCausale", "Colpa"));

        assertTrue(hint.contains("(Colpa, NessoCausale)"));
    }
}
