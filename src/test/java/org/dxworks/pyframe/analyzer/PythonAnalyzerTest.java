package org.dxworks.pyframe.analyzer;

import org.dxworks.pyframe.AnalysisException;
import org.dxworks.pyframe.ParseException;
import org.dxworks.pyframe.PyframeConfig;
import org.dxworks.pyframe.analyzer.indent.IndentationException;
import org.dxworks.pyframe.analyzer.lexer.LexException;
import org.dxworks.pyframe.model.AnalysisResult;
import org.dxworks.pyframe.model.CallSite;
import org.dxworks.pyframe.model.ClassDef;
import org.dxworks.pyframe.model.DiagnosticKind;
import org.dxworks.pyframe.model.FunctionDef;
import org.dxworks.pyframe.model.ImportEntry;
import org.dxworks.pyframe.model.Module;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.pyframe.TestUtils.readSample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PythonAnalyzerTest {

    private final PythonAnalyzer analyzer = new PythonAnalyzer();

    private Module analyze(String source) {
        return analyze("mod.py", source);
    }

    private Module analyze(String path, String source) {
        AnalysisResult result = analyzer.analyze(path, source);
        assertTrue(result.isSuccess(), () -> "analysis failed: " + result);
        return result.module().orElseThrow();
    }

    @Test
    void analyze_ClassWithBasesAndMethod() {
        Module module = analyze("class A(B, C):\n    def m(self): pass");

        assertEquals(1, module.root.children.size());
        ClassDef a = assertInstanceOf(ClassDef.class, module.root.children.get(0));
        assertEquals("A", a.qualifiedName);
        assertEquals(List.of("B", "C"), a.baseNames());
        assertEquals(1, a.members().size());
        FunctionDef m = assertInstanceOf(FunctionDef.class, a.members().get(0));
        assertEquals("A.m", m.qualifiedName);
        assertEquals(List.of("self"), m.parameterNames());
        assertEquals("A", m.body.parentQualifiedName);
    }

    @Test
    void analyze_StaticMethodDecorator() {
        FunctionDef f = assertInstanceOf(FunctionDef.class, analyze("@staticmethod\ndef f(): pass").root.children.get(0));

        assertTrue(f.isStatic);
        assertFalse(f.isClassmethod);
        assertFalse(f.isProperty);
        assertEquals(List.of("staticmethod"), f.decoratorNames());
    }

    @Test
    void analyze_RelativeImportOfPackageMember() {
        Module module = analyze("pkg/mod.py", "from . import utils\n");

        ImportEntry entry = module.imports.get(0);
        assertEquals(1, entry.level);
        assertTrue(entry.modulePath.isEmpty());
        assertEquals("utils", entry.symbol);
        assertFalse(entry.wildcard);
        assertEquals("pkg", entry.resolvedModule);
        assertEquals("utils", entry.boundName());
    }

    @Test
    void analyze_AsyncFunction() {
        FunctionDef fetch = assertInstanceOf(FunctionDef.class,
                analyze("async def fetch(): ...").root.children.get(0));

        assertTrue(fetch.isAsync);
        assertEquals("async def fetch()", fetch.signature());
    }

    @Test
    void analyze_UnterminatedString_FailsWithLexErrorAndNoEntities() {
        AnalysisResult result = analyzer.analyze("broken.py", "def f():\n    return 'oops\n");

        assertFalse(result.isSuccess());
        assertTrue(result.module().isEmpty());
        AnalysisException error = result.error().orElseThrow();
        LexException lex = assertInstanceOf(LexException.class, error);
        assertEquals(LexException.Kind.UNTERMINATED_STRING, lex.getKind());
        assertEquals(2, error.getSpan().startLine);
        assertEquals("broken", result.moduleName);
    }

    @Test
    void analyze_InconsistentDedent_FailsWithIndentationError() {
        AnalysisResult result = analyzer.analyze("m.py", "if a:\n        b()\n    c()\n");

        assertInstanceOf(IndentationException.class, result.error().orElseThrow());
    }

    @Test
    void analyze_UnclosedBracket_FailsWithParseError() {
        AnalysisResult result = analyzer.analyze("m.py", "x = (1,\n");

        ParseException error = assertInstanceOf(ParseException.class, result.error().orElseThrow());
        assertEquals("PARSE_UNBALANCED_BRACKETS", error.getErrorCode());
    }

    @Test
    void analyze_FormFeedLeadingIndentedLine_Succeeds() {
        AnalysisResult result = analyzer.analyze("m.py", "if x:\n\f    a = 1\n    b = 2\n");

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(2, result.module().orElseThrow().root.assignments.size());
    }

    @Test
    void analyze_ConfiguredTabStops_MeasureBlockWidths() {
        PythonAnalyzer wideTabs = new PythonAnalyzer(PyframeConfig.defaults().withTabSizes(8, 4));

        AnalysisResult result = wideTabs.analyze("m.py", "if x:\n\ta = 1\n  \tb = 2\n");

        assertTrue(result.isSuccess(), result.toString());
        assertEquals(2, result.module().orElseThrow().root.assignments.size());
    }

    @Test
    void analyze_SameSourceTwice_ProducesEqualModules() throws IOException {
        String source = readSample("sample.py");

        Module first = analyze("pkg/sample.py", source);
        Module second = analyze("pkg/sample.py", source);

        assertNotSame(first, second);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void analyze_StackedDecorators_AttachInSourceOrder() {
        FunctionDef f = assertInstanceOf(FunctionDef.class,
                analyze("@first\n@second.attr(1, k=2)\n@third\ndef f(): pass\n").root.children.get(0));

        assertEquals(List.of("first", "second.attr", "third"), f.decoratorNames());
        assertEquals(List.of("1", "k=2"), f.decorators.get(1).arguments);
        assertEquals("second.attr(1, k=2)", f.decorators.get(1).expression);
        assertEquals(4, f.span.startLine);
    }

    @Test
    void analyze_DecoratorWithoutDefinition_IsReportedAsOrphan() {
        AnalysisResult result = analyzer.analyze("m.py", "class A:\n    @cache\n    x = 1\n\n    @tail\n");

        assertTrue(result.isSuccess());
        List<DiagnosticKind> kinds = result.diagnostics.stream().map(d -> d.kind).collect(Collectors.toList());
        assertEquals(List.of(DiagnosticKind.ORPHANED_DECORATOR, DiagnosticKind.ORPHANED_DECORATOR), kinds);
        assertEquals(2, result.diagnostics.get(0).span.startLine);
        assertEquals(5, result.diagnostics.get(1).span.startLine);
        ClassDef a = (ClassDef) result.module().orElseThrow().root.children.get(0);
        assertTrue(a.members().isEmpty());
    }

    @Test
    void analyze_PropertyAccessorsAndClassmethod() {
        Module module = analyze("class C:\n"
                + "    @property\n    def x(self): return self._x\n"
                + "    @x.setter\n    def x(self, v): self._x = v\n"
                + "    @classmethod\n    def make(cls): return cls()\n");

        List<FunctionDef> members = ((ClassDef) module.root.children.get(0)).members().stream()
                .map(FunctionDef.class::cast)
                .collect(Collectors.toList());
        assertTrue(members.get(0).isProperty);
        assertTrue(members.get(1).isProperty);
        assertTrue(members.get(2).isClassmethod);
    }

    @Test
    void analyze_ConfiguredDecoratorMarkers() {
        PyframeConfig config = PyframeConfig.defaults()
                .withDecorators(List.of("staticmethod", "pure"), List.of("classmethod"), List.of("property"));
        AnalysisResult result = new PythonAnalyzer(config).analyze("m.py", "@pure\ndef f(): pass\n");

        FunctionDef f = (FunctionDef) result.module().orElseThrow().root.children.get(0);
        assertTrue(f.isStatic);
    }

    @Test
    void analyze_BaseClassesResolveWithinTheModuleOnly() {
        Module module = analyze("class Outer:\n"
                + "    class Inner(Base): pass\n"
                + "    class Child(Inner, ext.Thing): pass\n"
                + "class Base: pass\n"
                + "class Leaf(Outer.Inner, Missing): pass\n");

        ClassDef outer = (ClassDef) module.root.children.get(0);
        ClassDef inner = (ClassDef) outer.members().get(0);
        ClassDef child = (ClassDef) outer.members().get(1);
        ClassDef leaf = (ClassDef) module.root.children.get(2);

        assertEquals("Base", inner.bases.get(0).resolvedQualifiedName);
        assertEquals("Outer.Inner", child.bases.get(0).resolvedQualifiedName);
        assertFalse(child.bases.get(1).isResolved());
        assertEquals("Outer.Inner", leaf.bases.get(0).resolvedQualifiedName);
        assertNull(leaf.bases.get(1).resolvedQualifiedName);
        assertEquals("Missing", leaf.bases.get(1).text);
    }

    @Test
    void analyze_CallSitesAttachToInnermostScope() {
        Module module = analyze("setup()\n"
                + "def outer():\n"
                + "    prepare()\n"
                + "    def inner():\n"
                + "        work()\n"
                + "    for x in items():\n"
                + "        if ok(x):\n"
                + "            inner()\n");

        assertEquals(List.of("setup"), callees(module.root.calls));
        FunctionDef outer = (FunctionDef) module.root.children.get(0);
        assertEquals(List.of("prepare", "items", "ok", "inner"), callees(outer.body.calls));
        assertTrue(outer.body.calls.stream().allMatch(c -> c.scope.equals("outer")));
        FunctionDef inner = (FunctionDef) outer.body.children.get(0);
        assertEquals("outer.inner", inner.qualifiedName);
        assertEquals(List.of("work"), callees(inner.body.calls));
        assertEquals("outer.inner", inner.body.calls.get(0).scope);
    }

    @Test
    void analyze_DocstringsAssignmentsAndConstants() {
        Module module = analyze("'''Module doc.'''\n"
                + "VERSION = '1.0'\n"
                + "LIMITS = (1, -2)\n"
                + "handler = make()\n"
                + "a, b = 1, 2\n"
                + "class A:\n"
                + "    r\"\"\"\n    Class doc.\n    \"\"\"\n"
                + "    size: int = 3\n");

        assertEquals("Module doc.", module.docstring);
        assertEquals(List.of("VERSION", "LIMITS"),
                module.constants.stream().map(c -> c.name).collect(Collectors.toList()));
        assertEquals("'1.0'", module.constants.get(0).value);
        assertEquals(4, module.root.assignments.size());
        ClassDef a = (ClassDef) module.root.children.get(0);
        assertEquals("Class doc.", a.docstring);
        assertEquals("int", a.body.assignments.get(0).annotation);
    }

    @Test
    void analyze_NestedImportsAreCollectedInSourceOrder() {
        Module module = analyze("pkg/sub/__init__.py", "import os\n"
                + "def f():\n"
                + "    from .. import sibling\n"
                + "    from .impl import *\n"
                + "import sys\n");

        assertEquals("pkg.sub", module.name);
        assertEquals(List.of("import os", "from .. import sibling", "from .impl import *", "import sys"),
                module.imports.stream().map(ImportEntry::toString).collect(Collectors.toList()));
        assertEquals("pkg", module.imports.get(1).resolvedModule);
        assertEquals("pkg.sub.impl", module.imports.get(2).resolvedModule);
        assertTrue(module.imports.get(2).wildcard);
        FunctionDef f = (FunctionDef) module.root.children.get(0);
        assertEquals(2, f.body.imports.size());
        assertEquals(2, module.root.imports.size());
    }

    @Test
    void analyze_SkippedConstructsKeepPartialModel() {
        AnalysisResult result = analyzer.analyze("m.py", "def a(): pass\n"
                + "match x:\n    case 1:\n        pass\n"
                + "def b(): pass\n");

        assertTrue(result.isSuccess());
        assertEquals(1, result.diagnostics.size());
        assertEquals(DiagnosticKind.SKIPPED_CONSTRUCT, result.diagnostics.get(0).kind);
        assertEquals(2, result.module().orElseThrow().root.children.size());
    }

    @Test
    void analyze_Bytes_HonorsCodingDeclaration() {
        byte[] bytes = "# -*- coding: latin-1 -*-\nname = 'caf\u00e9'\n".getBytes(StandardCharsets.ISO_8859_1);

        AnalysisResult result = analyzer.analyze("m.py", bytes);

        assertEquals("'caf\u00e9'", result.module().orElseThrow().constants.get(0).value);
    }

    @Test
    void analyze_Bytes_InvalidUtf8_FailsWithLexError() {
        byte[] bytes = {'x', ' ', '=', ' ', (byte) 0xC3, (byte) 0x28, '\n'};

        AnalysisResult result = analyzer.analyze("m.py", bytes);

        LexException error = assertInstanceOf(LexException.class, result.error().orElseThrow());
        assertEquals(LexException.Kind.INVALID_CHARACTER, error.getKind());
        assertEquals(4, error.getSpan().startColumn);
    }

    @Test
    void analyze_NullArguments_AreRejected() {
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(null, "x = 1"));
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze("m.py", (String) null));
    }

    private static List<String> callees(List<CallSite> calls) {
        return calls.stream().map(c -> c.callee).collect(Collectors.toList());
    }
}
