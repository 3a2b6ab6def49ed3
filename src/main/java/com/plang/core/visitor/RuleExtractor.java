package com.plang.core.visitor;

import com.plang.core.ast.*;
import com.plang.core.grammar.Diagnostic;
import com.plang.core.grammar.GovernanceCategory;
import com.plang.core.ir.GovernanceDescriptor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a program and builds the {@link SymbolTable} that IR lowering consumes.
 * <p>
 * Duplicate declaration names are reported as diagnostics; the first declaration wins
 * and the duplicate's body is not visited. Rule references ({@code use X}) are listed
 * as children of the referencing policy; whether X exists is checked once the whole
 * program has been seen.
 */
public class RuleExtractor extends BaseVisitor<Void> {

    private final Map<String, Draft> drafts = new LinkedHashMap<>();
    private final Deque<Draft> scope = new ArrayDeque<>();
    private final List<String> imports = new ArrayList<>();
    private final List<RuleRef> ruleRefs = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public static SymbolTable extract(Program program) {
        var extractor = new RuleExtractor();
        extractor.visitNullable(program);
        return extractor.toSymbolTable();
    }

    @Override
    public Void visitImport(Import node) {
        imports.add(node.path());
        return null;
    }

    @Override
    public Void visitPolicyDecl(PolicyDecl node) {
        return declare(new Draft(node.name(), SymbolType.POLICY, node.category(), null), node, node.body());
    }

    @Override
    public Void visitRuleDecl(RuleDecl node) {
        Draft parent = scope.peek();
        String parentName = parent != null ? parent.name : node.parentPolicy();
        GovernanceCategory category = node.category() != null
                ? node.category()
                : (parent != null ? parent.category : null);
        if (parent != null) {
            parent.childRules.add(node.name());
        }
        return declare(new Draft(node.name(), SymbolType.RULE, category, parentName), node, node.body());
    }

    private Void declare(Draft draft, Node node, List<Node> body) {
        if (draft.name == null || draft.name.isBlank()) {
            diagnostics.add(Diagnostic.semantic(node.position(), "declaration without a name"));
            return null;
        }
        if (drafts.containsKey(draft.name)) {
            diagnostics.add(Diagnostic.semantic(node.position(),
                    "duplicate declaration '" + draft.name + "'"));
            return null;
        }
        drafts.put(draft.name, draft);
        scope.push(draft);
        try {
            visitAll(body);
        } finally {
            scope.pop();
        }
        return null;
    }

    @Override
    public Void visitRuleRef(RuleRef node) {
        Draft current = scope.peek();
        if (current != null && !current.childRules.contains(node.ruleName())) {
            current.childRules.add(node.ruleName());
        }
        ruleRefs.add(node);
        return null;
    }

    @Override
    public Void visitPriority(Priority node) {
        Draft current = scope.peek();
        if (current != null) {
            current.priority = node.value();
        }
        return null;
    }

    @Override
    public Void visitConditionBlock(ConditionBlock node) {
        Draft current = scope.peek();
        if (current == null) {
            return null;
        }
        String label = current.name + "#" + current.conditions.size();
        ActionBlock action = node.action();
        current.conditions.add(new ConditionSummary(
                label,
                node.condition(),
                node.condition() != null ? PrettyPrinter.print(node.condition()) : null,
                action != null ? action.kind() : null,
                action != null && action.routeTarget() != null ? action.routeTarget().targetName() : null,
                action != null ? action.reason() : null));
        return null;
    }

    SymbolTable toSymbolTable() {
        var allDiagnostics = new ArrayList<>(diagnostics);
        for (RuleRef ref : ruleRefs) {
            Draft target = drafts.get(ref.ruleName());
            if (target == null) {
                allDiagnostics.add(Diagnostic.semantic(ref.position(),
                        "unknown rule '" + ref.ruleName() + "'"));
            } else if (target.type != SymbolType.RULE) {
                allDiagnostics.add(Diagnostic.semantic(ref.position(),
                        "'" + ref.ruleName() + "' is a policy, not a rule"));
            }
        }
        var symbols = new LinkedHashMap<String, SymbolInfo>();
        drafts.forEach((name, d) -> symbols.put(name, new SymbolInfo(
                d.name, d.type, GovernanceCategory.orDefault(d.category),
                d.priority != null ? d.priority : GovernanceDescriptor.DEFAULT_PRIORITY,
                d.parentPolicy, d.childRules, d.conditions)));
        var refNames = ruleRefs.stream().map(RuleRef::ruleName).toList();
        return new SymbolTable(symbols, imports, refNames, allDiagnostics);
    }

    private static final class Draft {
        final String name;
        final SymbolType type;
        final GovernanceCategory category;
        final String parentPolicy;
        Integer priority;
        final List<String> childRules = new ArrayList<>();
        final List<ConditionSummary> conditions = new ArrayList<>();

        Draft(String name, SymbolType type, GovernanceCategory category, String parentPolicy) {
            this.name = name;
            this.type = type;
            this.category = category;
            this.parentPolicy = parentPolicy;
        }
    }
}
