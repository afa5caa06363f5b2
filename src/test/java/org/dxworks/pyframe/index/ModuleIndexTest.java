package org.dxworks.pyframe.index;

import org.dxworks.pyframe.analyzer.PythonAnalyzer;
import org.dxworks.pyframe.model.CallSite;
import org.dxworks.pyframe.model.ClassDef;
import org.dxworks.pyframe.model.Definition;
import org.dxworks.pyframe.model.EntityKind;
import org.dxworks.pyframe.model.FunctionDef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModuleIndexTest {

    private static final String SOURCE = String.join("\n",
            "import os",
            "",
            "class Base:",
            "    def run(self):",
            "        log('base')",
            "",
            "class Child(Base):",
            "    @property",
            "    def value(self):",
            "        return self._value",
            "",
            "    @value.setter",
            "    def value(self, v):",
            "        self._value = v",
            "",
            "    class Inner(Base):",
            "        pass",
            "",
            "def _private():",
            "    pass",
            "",
            "def main():",
            "    Child().run()",
            "    def nested():",
            "        os.getcwd()",
            "");

    private ModuleIndex index;

    @BeforeEach
    void setUp() {
        index = new ModuleIndex(new PythonAnalyzer().analyze("app/core.py", SOURCE).module().orElseThrow());
    }

    private static List<String> names(List<? extends Definition> definitions) {
        return definitions.stream().map(d -> d.qualifiedName).collect(Collectors.toList());
    }

    @Test
    void lookup_ByQualifiedName() {
        assertEquals(EntityKind.FUNCTION, index.lookup("Base.run").orElseThrow().kind());
        assertEquals(EntityKind.CLASS, index.lookup("Child.Inner").orElseThrow().kind());
        assertFalse(index.lookup("run").isPresent());
        assertFalse(index.lookup("Missing").isPresent());
    }

    @Test
    void lookup_DuplicateQualifiedName_ReturnsLastDefinition() {
        List<Definition> all = index.lookupAll("Child.value");

        assertEquals(2, all.size());
        FunctionDef last = (FunctionDef) index.lookup("Child.value").orElseThrow();
        assertEquals(List.of("self", "v"), last.parameterNames());
        assertTrue(last.isProperty);
    }

    @Test
    void definitions_InSourceOrderAndByKind() {
        assertEquals(List.of("Base", "Base.run", "Child", "Child.value", "Child.value", "Child.Inner",
                "_private", "main", "main.nested"), names(index.definitions()));
        assertEquals(List.of("Base", "Child", "Child.Inner"), names(index.definitions(EntityKind.CLASS)));
        assertEquals(6, index.functions().size());
        assertEquals(3, index.classes().size());
    }

    @Test
    void childrenAndParent() {
        assertEquals(List.of("Base", "Child", "_private", "main"), names(index.children("")));
        assertEquals(index.topLevel(), index.children(""));
        assertEquals(List.of("Child.value", "Child.value", "Child.Inner"), names(index.children("Child")));
        assertTrue(index.children("nope").isEmpty());

        assertEquals("main", index.parent("main.nested").orElseThrow().qualifiedName);
        assertFalse(index.parent("main").isPresent());
        assertFalse(index.parent("nope").isPresent());
    }

    @Test
    void scope_RootIsEmptyName() {
        assertTrue(index.scope("").orElseThrow().isRoot());
        assertEquals("main", index.scope("main.nested").orElseThrow().parentQualifiedName);
    }

    @Test
    void exports_SkipUnderscoreNames() {
        assertEquals(List.of("Base", "Child", "main"), names(index.exports()));
    }

    @Test
    void calls_AreAttributedToInnermostScope() {
        List<String> mainCalls = index.callsIn("main").stream().map(c -> c.callee).collect(Collectors.toList());
        assertEquals(List.of("Child", "Child().run"), mainCalls);

        CallSite nested = index.callsIn("main.nested").get(0);
        assertEquals("os.getcwd", nested.callee);
        assertEquals("main.nested", nested.scope);

        assertEquals(4, index.calls().size());
    }

    @Test
    void subclassesOf_UsesResolvedBases() {
        List<ClassDef> subclasses = index.subclassesOf("Base");

        assertEquals(List.of("Child", "Child.Inner"), names(subclasses));
        assertTrue(index.subclassesOf("Child").isEmpty());
    }

    @Test
    void imports_FromModule() {
        assertEquals(1, index.imports().size());
        assertEquals("os", index.imports().get(0).resolvedModule);
        assertEquals("app.core", index.module().name);
    }
}
