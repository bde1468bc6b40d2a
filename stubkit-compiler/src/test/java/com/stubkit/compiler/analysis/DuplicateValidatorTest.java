package com.stubkit.compiler.analysis;

import com.stubkit.compiler.model.*;
import com.stubkit.compiler.model.type.NamedType;
import com.stubkit.compiler.model.type.StubType;
import com.stubkit.compiler.parser.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DuplicateValidator 单元测试
 */
class DuplicateValidatorTest {

    private static final StubType INT = new NamedType("int");

    private static Function function(String name) {
        Signature sig = new Signature(Collections.<Parameter>emptyList(), null, null, INT,
                Collections.<StubType>emptyList());
        return new Function(name, Collections.singletonList(sig), FunctionKind.METHOD, false);
    }

    @Test
    @DisplayName("顶层重名一次全部报告，按名称排序")
    void testModuleDuplicates() {
        StubModule module = new StubModule("m",
                Arrays.asList(new Constant("x", INT), new Constant("y", INT)),
                Collections.<TypeParameter>emptyList(),
                Collections.singletonList(new StubClass("y", Collections.<StubType>emptyList(), null,
                        Collections.<Constant>emptyList(), Collections.<Function>emptyList())),
                Collections.singletonList(function("x")),
                Collections.<Alias>emptyList());
        ParseException e = assertThrows(ParseException.class,
                () -> new DuplicateValidator(new NameRegistry(null)).validateModule(module));
        assertEquals("Duplicate top-level identifier(s): x, y", e.getMessage());
        assertNull(e.getLine());
    }

    @Test
    @DisplayName("带模块前缀的名称按去前缀后比较")
    void testQualifiedNames() {
        StubModule module = new StubModule("foo",
                Collections.singletonList(new Constant("foo.x", INT)),
                Collections.singletonList(new TypeParameter("x", Collections.<StubType>emptyList())),
                Collections.<StubClass>emptyList(), Collections.<Function>emptyList(),
                Collections.<Alias>emptyList());
        ParseException e = assertThrows(ParseException.class,
                () -> new DuplicateValidator(new NameRegistry("foo")).validateModule(module));
        assertEquals("Duplicate top-level identifier(s): x", e.getMessage());
    }

    @Test
    @DisplayName("类体重名报告在类声明行")
    void testClassDuplicates() {
        StubClass cls = new StubClass("A", Collections.<StubType>emptyList(), null,
                Collections.singletonList(new Constant("f", INT)), Collections.singletonList(function("f")));
        ParseException e = assertThrows(ParseException.class,
                () -> new DuplicateValidator(new NameRegistry(null)).validateClass(cls, 3));
        assertEquals("Duplicate identifier(s): f", e.getMessage());
        assertEquals(Integer.valueOf(3), e.getLine());
    }

    @Test
    @DisplayName("没有重名时通过")
    void testNoDuplicates() {
        assertTrue(DuplicateValidator.findDuplicates(Arrays.asList("a", "b", "c")).isEmpty());
        assertEquals(Collections.singleton("a"), DuplicateValidator.findDuplicates(Arrays.asList("a", "b", "a", "a")));
    }
}
