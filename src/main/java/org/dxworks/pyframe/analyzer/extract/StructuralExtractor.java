package org.dxworks.pyframe.analyzer.extract;

import org.dxworks.pyframe.analyzer.ModulePaths;
import org.dxworks.pyframe.analyzer.parser.tree.AssignmentNode;
import org.dxworks.pyframe.analyzer.parser.tree.BlockNode;
import org.dxworks.pyframe.analyzer.parser.tree.CallNode;
import org.dxworks.pyframe.analyzer.parser.tree.ClassNode;
import org.dxworks.pyframe.analyzer.parser.tree.DecoratorNode;
import org.dxworks.pyframe.analyzer.parser.tree.ExpressionNode;
import org.dxworks.pyframe.analyzer.parser.tree.FromImportNode;
import org.dxworks.pyframe.analyzer.parser.tree.FunctionNode;
import org.dxworks.pyframe.analyzer.parser.tree.ImportNode;
import org.dxworks.pyframe.analyzer.parser.tree.ImportedName;
import org.dxworks.pyframe.analyzer.parser.tree.ModuleNode;
import org.dxworks.pyframe.analyzer.parser.tree.SimpleNode;
import org.dxworks.pyframe.analyzer.parser.tree.SkippedNode;
import org.dxworks.pyframe.analyzer.parser.tree.StatementNode;
import org.dxworks.pyframe.analyzer.parser.tree.StatementVisitor;
import org.dxworks.pyframe.model.Assignment;
import org.dxworks.pyframe.model.BaseClassRef;
import org.dxworks.pyframe.model.CallSite;
import org.dxworks.pyframe.model.ClassDef;
import org.dxworks.pyframe.model.Constant;
import org.dxworks.pyframe.model.Decorator;
import org.dxworks.pyframe.model.Diagnostic;
import org.dxworks.pyframe.model.DiagnosticKind;
import org.dxworks.pyframe.model.FunctionDef;
import org.dxworks.pyframe.model.ImportEntry;
import org.dxworks.pyframe.model.Module;
import org.dxworks.pyframe.model.Scope;
import org.dxworks.pyframe.model.ScopeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Walks a parse tree once, in source order, and builds the structural {@link Module}.
 *
 * Keeps a stack of open scopes: definitions push a scope for their body, and every call, import and
 * assignment is recorded in the innermost open scope. Control-flow blocks do not open scopes.
 * Decorators are held until the next statement of the same body; a definition takes them all, any
 * other statement (or the end of the body) reports them as orphaned.
 */
public final class StructuralExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(StructuralExtractor.class);

    private static final Pattern DOTTED_NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*(\\.[\\p{L}_][\\p{L}\\p{N}_]*)*");
    private static final Pattern NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_]*");

    private final DecoratorMarkers markers;

    public StructuralExtractor() {
        this(DecoratorMarkers.defaults());
    }

    public StructuralExtractor(DecoratorMarkers markers) {
        this.markers = markers;
    }

    /**
     * Builds the module model for {@code tree}.
     *
     * @param moduleName  dotted module label, used to resolve relative imports
     * @param path        originating path of the unit
     * @param diagnostics receives orphaned-decorator notices in source order
     */
    public Module extract(ModuleNode tree, String moduleName, String path, List<Diagnostic> diagnostics) {
        Walk walk = new Walk(moduleName, ModulePaths.isPackage(path), collectClassNames(tree), diagnostics);
        Scope root = walk.run(tree);
        Module module = new Module(moduleName, path, docstring(tree.body), root, walk.allImports, walk.constants);
        LOG.debug("Extracted {} from {}: {} top-level definitions, {} imports",
                moduleName, path, root.children.size(), walk.allImports.size());
        return module;
    }

    private final class Walk implements StatementVisitor<Void> {
        private final String moduleName;
        private final boolean isPackage;
        private final Set<String> classNames;
        private final List<Diagnostic> diagnostics;
        private final Deque<Scope.Builder> scopes = new ArrayDeque<>();
        private final List<ImportEntry> allImports = new ArrayList<>();
        private final List<Constant> constants = new ArrayList<>();
        private final List<DecoratorNode> pending = new ArrayList<>();

        Walk(String moduleName, boolean isPackage, Set<String> classNames, List<Diagnostic> diagnostics) {
            this.moduleName = moduleName;
            this.isPackage = isPackage;
            this.classNames = classNames;
            this.diagnostics = diagnostics;
        }

        Scope run(ModuleNode tree) {
            scopes.push(Scope.builder(ScopeKind.MODULE, moduleName, "", null));
            walkBody(tree.body);
            return scopes.pop().build();
        }

        private void walkBody(List<StatementNode> body) {
            for (StatementNode statement : body) {
                if (!(statement instanceof DecoratorNode)
                        && !(statement instanceof FunctionNode)
                        && !(statement instanceof ClassNode)) {
                    orphanPending();
                }
                statement.accept(this);
            }
            orphanPending();
        }

        private void orphanPending() {
            for (DecoratorNode decorator : pending) {
                diagnostics.add(new Diagnostic(DiagnosticKind.ORPHANED_DECORATOR,
                        "Decorator @" + decorator.expression + " is not followed by a definition", decorator.span));
            }
            pending.clear();
        }

        private List<Decorator> takeDecorators() {
            List<Decorator> decorators = new ArrayList<>();
            for (DecoratorNode node : pending) {
                decorators.add(new Decorator(node.expression, node.name, node.arguments, node.span));
            }
            pending.clear();
            return decorators;
        }

        private Scope.Builder current() {
            return scopes.peek();
        }

        private String qualify(String name) {
            String parent = current().qualifiedName();
            return parent.isEmpty() ? name : parent + "." + name;
        }

        private void recordCalls(StatementNode node) {
            String scope = current().qualifiedName();
            for (CallNode call : node.calls) {
                current().addCall(new CallSite(call.callee, call.arguments, call.span, scope));
            }
        }

        private void addImport(ImportEntry entry) {
            current().addImport(entry);
            allImports.add(entry);
        }

        @Override
        public Void visitImport(ImportNode node) {
            for (ImportedName name : node.names) {
                addImport(new ImportEntry(name.path, null, false, name.alias, 0,
                        String.join(".", name.path), name.span));
            }
            return null;
        }

        @Override
        public Void visitFromImport(FromImportNode node) {
            String resolved = ModulePaths.resolveRelative(moduleName, isPackage, node.level, node.module);
            if (node.wildcard) {
                addImport(new ImportEntry(node.module, null, true, null, node.level, resolved, node.span));
                return null;
            }
            for (ImportedName name : node.names) {
                addImport(new ImportEntry(node.module, name.path.get(0), false, name.alias, node.level, resolved,
                        name.span));
            }
            return null;
        }

        @Override
        public Void visitDecorator(DecoratorNode node) {
            pending.add(node);
            return null;
        }

        @Override
        public Void visitFunction(FunctionNode node) {
            List<Decorator> decorators = takeDecorators();
            recordCalls(node);
            String qualifiedName = qualify(node.name);
            scopes.push(Scope.builder(ScopeKind.FUNCTION, node.name, qualifiedName, current().qualifiedName()));
            walkBody(node.body);
            Scope body = scopes.pop().build();
            current().addChild(new FunctionDef(node.name, qualifiedName, node.parameters, node.returnAnnotation,
                    node.isAsync, markers.isStatic(decorators), markers.isClassmethod(decorators),
                    markers.isProperty(decorators), decorators, docstring(node.body), node.span, body));
            return null;
        }

        @Override
        public Void visitClass(ClassNode node) {
            List<Decorator> decorators = takeDecorators();
            recordCalls(node);
            String enclosing = current().qualifiedName();
            String qualifiedName = qualify(node.name);
            List<BaseClassRef> bases = new ArrayList<>();
            for (String base : node.bases) {
                bases.add(new BaseClassRef(base, resolveBase(base, enclosing, qualifiedName)));
            }
            scopes.push(Scope.builder(ScopeKind.CLASS, node.name, qualifiedName, enclosing));
            walkBody(node.body);
            Scope body = scopes.pop().build();
            current().addChild(new ClassDef(node.name, qualifiedName, bases, node.keywords, decorators,
                    docstring(node.body), node.span, body));
            return null;
        }

        /** Tries the base name against each enclosing scope, innermost first, then the module root. */
        private String resolveBase(String base, String enclosing, String self) {
            if (!DOTTED_NAME.matcher(base).matches()) {
                return null;
            }
            String prefix = enclosing;
            while (true) {
                String candidate = prefix.isEmpty() ? base : prefix + "." + base;
                if (!candidate.equals(self) && classNames.contains(candidate)) {
                    return candidate;
                }
                if (prefix.isEmpty()) {
                    return null;
                }
                int dot = prefix.lastIndexOf('.');
                prefix = dot < 0 ? "" : prefix.substring(0, dot);
            }
        }

        @Override
        public Void visitAssignment(AssignmentNode node) {
            recordCalls(node);
            current().addAssignment(new Assignment(node.targets, node.annotation, node.operator, node.value,
                    node.span));
            if (current().kind() == ScopeKind.MODULE && node.literalValue && node.operator.equals("=")
                    && node.targets.size() == 1 && NAME.matcher(node.targets.get(0)).matches()) {
                constants.add(new Constant(node.targets.get(0), node.value, node.span));
            }
            return null;
        }

        @Override
        public Void visitExpression(ExpressionNode node) {
            recordCalls(node);
            return null;
        }

        @Override
        public Void visitBlock(BlockNode node) {
            recordCalls(node);
            walkBody(node.body);
            return null;
        }

        @Override
        public Void visitSimple(SimpleNode node) {
            recordCalls(node);
            return null;
        }

        @Override
        public Void visitSkipped(SkippedNode node) {
            return null;
        }
    }

    /** Qualified names of every class in the tree, so base references may point forward. */
    private static Set<String> collectClassNames(ModuleNode tree) {
        Set<String> names = new HashSet<>();
        collectClassNames(tree.body, "", names);
        return names;
    }

    private static void collectClassNames(List<StatementNode> body, String prefix, Set<String> names) {
        for (StatementNode statement : body) {
            if (statement instanceof ClassNode) {
                ClassNode node = (ClassNode) statement;
                String qualifiedName = prefix.isEmpty() ? node.name : prefix + "." + node.name;
                names.add(qualifiedName);
                collectClassNames(node.body, qualifiedName, names);
            } else if (statement instanceof FunctionNode) {
                FunctionNode node = (FunctionNode) statement;
                collectClassNames(node.body, prefix.isEmpty() ? node.name : prefix + "." + node.name, names);
            } else if (statement instanceof BlockNode) {
                collectClassNames(((BlockNode) statement).body, prefix, names);
            }
        }
    }

    /** Docstring of a body: its first statement when that is a bare string literal. */
    static String docstring(List<StatementNode> body) {
        if (body.isEmpty() || !(body.get(0) instanceof ExpressionNode)) {
            return null;
        }
        ExpressionNode first = (ExpressionNode) body.get(0);
        return first.stringLiteral && !hasFormatOrBytesPrefix(first.text) ? stripQuotes(first.text).trim() : null;
    }

    /** True when any of the adjacent literals is an f-string or a bytes literal, which never form a docstring. */
    static boolean hasFormatOrBytesPrefix(String literals) {
        int i = 0;
        int prefixStart = 0;
        while (i < literals.length()) {
            char c = literals.charAt(i);
            if (c != '\'' && c != '"') {
                if (!Character.isLetter(c)) {
                    prefixStart = i + 1;
                }
                i++;
                continue;
            }
            String prefix = literals.substring(prefixStart, i).toLowerCase();
            if (prefix.indexOf('f') >= 0 || prefix.indexOf('b') >= 0) {
                return true;
            }
            i = endOfLiteral(literals, i);
            prefixStart = i;
        }
        return false;
    }

    private static int endOfLiteral(String literals, int open) {
        char c = literals.charAt(open);
        String quote = literals.startsWith(String.valueOf(new char[]{c, c, c}), open)
                ? String.valueOf(new char[]{c, c, c})
                : String.valueOf(c);
        int end = open + quote.length();
        while (end < literals.length() && !literals.startsWith(quote, end)) {
            end += literals.charAt(end) == '\\' ? 2 : 1;
        }
        return Math.min(end, literals.length()) + quote.length();
    }

    /** Contents of one or more adjacent string literals, prefixes and quotes removed, escapes kept as written. */
    static String stripQuotes(String literals) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        while (i < literals.length()) {
            char c = literals.charAt(i);
            if (c != '\'' && c != '"') {
                i++;
                continue;
            }
            String quote = literals.startsWith(String.valueOf(new char[]{c, c, c}), i)
                    ? String.valueOf(new char[]{c, c, c})
                    : String.valueOf(c);
            int start = i + quote.length();
            int end = start;
            while (end < literals.length() && !literals.startsWith(quote, end)) {
                end += literals.charAt(end) == '\\' ? 2 : 1;
            }
            end = Math.min(end, literals.length());
            sb.append(literals, start, end);
            i = end + quote.length();
        }
        return sb.toString();
    }
}
