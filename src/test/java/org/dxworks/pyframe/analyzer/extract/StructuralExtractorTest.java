package org.dxworks.pyframe.analyzer.extract;

import org.dxworks.pyframe.analyzer.indent.IndentationResolver;
import org.dxworks.pyframe.analyzer.lexer.Tokenizer;
import org.dxworks.pyframe.analyzer.parser.Parser;
import org.dxworks.pyframe.model.Decorator;
import org.dxworks.pyframe.model.Diagnostic;
import org.dxworks.pyframe.model.FunctionDef;
import org.dxworks.pyframe.model.Module;
import org.dxworks.pyframe.model.ScopeKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuralExtractorTest {

    private static Module extract(String source, List<Diagnostic> diagnostics) {
        Parser parser = new Parser(new IndentationResolver().resolve(new Tokenizer(source)));
        return new StructuralExtractor().extract(parser.parse(), "pkg.mod", "pkg/mod.py", diagnostics);
    }

    private static Decorator decorator(String name) {
        return new Decorator(name, name, List.of(), null);
    }

    @Test
    void extract_RootScopeIsUnnamedModuleScope() {
        Module module = extract("def f(): pass\n", new ArrayList<>());

        assertEquals(ScopeKind.MODULE, module.root.kind);
        assertEquals("", module.root.qualifiedName);
        assertTrue(module.root.isRoot());
        assertEquals("pkg.mod", module.name);
        assertEquals("pkg.mod.f", module.fullyQualifiedName(module.root.children.get(0).qualifiedName));
    }

    @Test
    void extract_FunctionScopesNestUnderTheirParent() {
        Module module = extract("class A:\n    def m(self):\n        def helper(): pass\n", new ArrayList<>());

        FunctionDef m = (FunctionDef) module.root.children.get(0).body.children.get(0);
        assertEquals(ScopeKind.FUNCTION, m.body.kind);
        assertEquals("A", m.body.parentQualifiedName);
        assertEquals("A.m.helper", m.body.children.get(0).qualifiedName);
    }

    @Test
    void extract_DecoratorBeforeControlFlow_IsOrphaned() {
        List<Diagnostic> diagnostics = new ArrayList<>();

        Module module = extract("@wrap\nif x:\n    def f(): pass\n", diagnostics);

        assertEquals(1, diagnostics.size());
        FunctionDef f = (FunctionDef) module.root.children.get(0);
        assertTrue(f.decorators.isEmpty());
    }

    @Test
    void docstring_OnlyForLeadingStringStatement() {
        assertEquals("doc", extract("'doc'\nx = 1\n", new ArrayList<>()).docstring);
        assertNull(extract("x = 1\n'not doc'\n", new ArrayList<>()).docstring);
        assertNull(extract("'a'.upper()\n", new ArrayList<>()).docstring);
    }

    @Test
    void docstring_NotForFormatOrBytesLiterals() {
        assertNull(extract("f'doc {x}'\n", new ArrayList<>()).docstring);
        assertNull(extract("B\"doc\"\n", new ArrayList<>()).docstring);
        assertNull(extract("'a' f'b'\n", new ArrayList<>()).docstring);
        assertNull(extract("def f():\n    rb'raw'\n", new ArrayList<>()).root.children.get(0).docstring);
        assertEquals("raw", extract("r'raw'\n", new ArrayList<>()).docstring);
        assertEquals("text", extract("u'text'\n", new ArrayList<>()).docstring);
    }

    @Test
    void stripQuotes_HandlesPrefixesTripleQuotesAndConcatenation() {
        assertEquals("abc", StructuralExtractor.stripQuotes("'abc'"));
        assertEquals(" multi\nline ", StructuralExtractor.stripQuotes("\"\"\" multi\nline \"\"\""));
        assertEquals("raw\\d", StructuralExtractor.stripQuotes("r'raw\\d'"));
        assertEquals("one two", StructuralExtractor.stripQuotes("'one ' \"two\""));
        assertEquals("it\\'s", StructuralExtractor.stripQuotes("'it\\'s'"));
    }

    @Test
    void markers_RecognizeConfiguredNamesAndAccessors() {
        DecoratorMarkers markers = new DecoratorMarkers(Set.of("staticmethod"), Set.of("classmethod"),
                Set.of("property", "functools.cached_property"));

        assertTrue(markers.isStatic(List.of(decorator("other"), decorator("staticmethod"))));
        assertFalse(markers.isStatic(List.of(decorator("static"))));
        assertTrue(markers.isClassmethod(List.of(decorator("classmethod"))));
        assertTrue(markers.isProperty(List.of(decorator("functools.cached_property"))));
        assertTrue(markers.isProperty(List.of(decorator("value.deleter"))));
        assertFalse(markers.isProperty(List.of(decorator("cached_property"))));
    }
}
