package com.plang.core.visitor;

import com.plang.core.grammar.ActionKind;
import com.plang.core.grammar.GovernanceCategory;
import com.plang.core.grammar.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleExtractorTest {

    @Test
    @DisplayName("records type, category, priority, parent, children and conditions")
    void extractsSymbols() {
        var table = RuleExtractor.extract(Parser.parse("""
                import "lib.plang"
                policy content : safety {
                  priority 20
                  when score > 0.9 then DENY "toxic"
                  when score > 0.5 then ROUTE to review
                  rule profanity { when contains(text, "x") then ESCALATE }
                  use review
                }
                rule review : routing { when true then ALLOW }
                """));

        assertFalse(table.hasErrors());
        assertEquals(List.of("content", "profanity", "review"), List.copyOf(table.names()));
        assertEquals(List.of("lib.plang"), table.imports());
        assertEquals(List.of("review"), table.ruleRefs());

        SymbolInfo content = table.lookup("content").orElseThrow();
        assertEquals(SymbolType.POLICY, content.type());
        assertEquals(GovernanceCategory.SAFETY, content.category());
        assertEquals(20, content.priority());
        assertNull(content.parentPolicy());
        assertEquals(List.of("profanity", "review"), content.childRules());
        assertEquals(2, content.conditions().size());

        ConditionSummary route = content.conditions().get(1);
        assertEquals("content#1", route.label());
        assertEquals("score > 0.5", route.conditionText());
        assertEquals(ActionKind.ROUTE, route.action());
        assertEquals("review", route.routeTarget());

        SymbolInfo profanity = table.lookup("profanity").orElseThrow();
        assertEquals(SymbolType.RULE, profanity.type());
        assertEquals("content", profanity.parentPolicy());
        assertEquals(GovernanceCategory.SAFETY, profanity.category());
        assertEquals(50, profanity.priority());
    }

    @Test
    @DisplayName("defaults: CUSTOM category and priority 50")
    void defaults() {
        var table = RuleExtractor.extract(Parser.parse("policy p { when true then ALLOW }"));
        SymbolInfo p = table.lookup("p").orElseThrow();
        assertEquals(GovernanceCategory.CUSTOM, p.category());
        assertEquals(50, p.priority());
    }

    @Test
    @DisplayName("duplicate names are diagnosed and the first declaration wins")
    void duplicates() {
        var table = RuleExtractor.extract(Parser.parse("""
                policy p : safety { when true then DENY }
                policy p : privacy { when true then ALLOW }
                """));
        assertTrue(table.hasErrors());
        assertEquals(1, table.diagnostics().size());
        assertTrue(table.diagnostics().get(0).message().contains("duplicate declaration 'p'"));
        assertEquals(2, table.diagnostics().get(0).position().line());
        assertEquals(GovernanceCategory.SAFETY, table.lookup("p").orElseThrow().category());
        assertEquals(1, table.size());
    }

    @Test
    @DisplayName("references to unknown rules or to policies are diagnosed")
    void badReferences() {
        var table = RuleExtractor.extract(Parser.parse("""
                policy a { use missing }
                policy b { use a }
                """));
        assertEquals(2, table.diagnostics().size());
        assertTrue(table.diagnostics().get(0).message().contains("unknown rule 'missing'"));
        assertTrue(table.diagnostics().get(1).message().contains("is a policy"));
    }

    @Test
    @DisplayName("a rule may be referenced before it is declared")
    void forwardReference() {
        var table = RuleExtractor.extract(Parser.parse("""
                policy a { use later }
                rule later { }
                """));
        assertFalse(table.hasErrors());
    }
}
