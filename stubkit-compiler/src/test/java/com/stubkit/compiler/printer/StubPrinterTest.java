package com.stubkit.compiler.printer;

import com.stubkit.compiler.model.*;
import com.stubkit.compiler.model.type.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StubPrinter 单元测试：直接从模型构造，不经过解析
 */
class StubPrinterTest {

    private static final NamedType INT = new NamedType("int");
    private static final NamedType STR = new NamedType("str");

    private static StubModule moduleWith(String name, List<Constant> constants, List<StubClass> classes,
                                         List<Function> functions, List<Alias> aliases) {
        return new StubModule(name, constants, Collections.<TypeParameter>emptyList(), classes, functions, aliases);
    }

    private static Function function(String name, Signature... signatures) {
        return new Function(name, Arrays.asList(signatures), FunctionKind.METHOD, false);
    }

    private static Signature signature(List<Parameter> params, StubType returnType) {
        return new Signature(params, null, null, returnType, Collections.<StubType>emptyList());
    }

    @Nested
    @DisplayName("导入推导")
    class ImportTests {

        @Test
        @DisplayName("点号类型按模块排序导入，跳过本模块")
        void testModuleImports() {
            StubModule module = moduleWith("m",
                    Arrays.asList(new Constant("m.a", new NamedType("zeta.Z")),
                            new Constant("m.b", new NamedType("alpha.beta.B")),
                            new Constant("m.c", new NamedType("m.C"))),
                    Collections.<StubClass>emptyList(), Collections.<Function>emptyList(),
                    Collections.<Alias>emptyList());
            assertEquals("import alpha.beta\nimport zeta\n\n"
                    + "m.a = ...  # type: zeta.Z\n"
                    + "m.b = ...  # type: alpha.beta.B\n"
                    + "m.c = ...  # type: m.C", new StubPrinter().print(module));
        }

        @Test
        @DisplayName("mutator 类型不参与导入推导")
        void testMutatorNotImported() {
            Parameter x = new Parameter("x", new NamedType("list"), false, false,
                    new GenericType(new NamedType("list"), Collections.<StubType>singletonList(new NamedType("foo.T"))));
            StubModule module = moduleWith("m", Collections.<Constant>emptyList(),
                    Collections.<StubClass>emptyList(),
                    Collections.singletonList(function("f", signature(Collections.singletonList(x), NamedType.NONE))),
                    Collections.<Alias>emptyList());
            assertEquals("def f(x: list) -> None:\n    x := List[foo.T]", new StubPrinter().print(module));
        }
    }

    @Nested
    @DisplayName("别名")
    class AliasTests {

        @Test
        @DisplayName("点号目标打印为 from 导入，去掉本模块前缀")
        void testFromAlias() {
            StubModule module = moduleWith("m", Collections.<Constant>emptyList(),
                    Collections.<StubClass>emptyList(), Collections.<Function>emptyList(),
                    Arrays.asList(new Alias("m.Bar", new NamedType("foo.Bar")),
                            new Alias("m.Q", new NamedType("foo.bar.Baz")),
                            new Alias("m.X", UnionType.of(Arrays.<StubType>asList(INT, STR)))));
            assertEquals("from typing import Union\n\n"
                    + "from foo import Bar\n"
                    + "from foo.bar import Baz as Q\n"
                    + "X = Union[int, str]", new StubPrinter().print(module));
        }
    }

    @Nested
    @DisplayName("签名")
    class SignatureTests {

        @Test
        @DisplayName("仅关键字参数在没有 *args 时打印裸星号")
        void testBareStar() {
            Parameter a = new Parameter("a", INT);
            Parameter b = new Parameter("b", STR, true, true, null);
            StubModule module = moduleWith("m", Collections.<Constant>emptyList(),
                    Collections.<StubClass>emptyList(),
                    Collections.singletonList(function("f", signature(Arrays.asList(a, b), INT))),
                    Collections.<Alias>emptyList());
            assertEquals("def f(a: int, *, b: str = ...) -> int: ...", new StubPrinter().print(module));
        }

        @Test
        @DisplayName("静态方法与类方法的每个重载都带装饰器")
        void testDecoratorsPerOverload() {
            Signature s1 = signature(Collections.singletonList(new Parameter("x", INT)), INT);
            Signature s2 = signature(Collections.singletonList(new Parameter("x", STR)), STR);
            Function f = new Function("f", Arrays.asList(s1, s2), FunctionKind.CLASSMETHOD, false);
            StubClass cls = new StubClass("A", Collections.<StubType>emptyList(), null,
                    Collections.<Constant>emptyList(), Collections.singletonList(f));
            StubModule module = moduleWith("m", Collections.<Constant>emptyList(), Collections.singletonList(cls),
                    Collections.<Function>emptyList(), Collections.<Alias>emptyList());
            assertEquals("class A:\n"
                    + "    @classmethod\n"
                    + "    def f(x: int) -> int: ...\n"
                    + "    @classmethod\n"
                    + "    def f(x: str) -> str: ...\n", new StubPrinter().print(module));
        }

        @Test
        @DisplayName("缩进宽度可配置")
        void testIndentSize() {
            PrintConfig config = new PrintConfig();
            config.setIndentSize(2);
            StubClass cls = new StubClass("A", Collections.<StubType>emptyList(), null,
                    Collections.singletonList(new Constant("x", INT)), Collections.<Function>emptyList());
            StubModule module = moduleWith("m", Collections.<Constant>emptyList(), Collections.singletonList(cls),
                    Collections.<Function>emptyList(), Collections.<Alias>emptyList());
            assertEquals("class A:\n  x = ...  # type: int\n", new StubPrinter(config).print(module));
        }
    }

    @Nested
    @DisplayName("单个类型")
    class TypeTests {

        private final StubPrinter printer = new StubPrinter();

        @Test
        @DisplayName("基础类型")
        void testBasic() {
            assertEquals("None", printer.printType(NamedType.NONE));
            assertEquals("Any", printer.printType(AnythingType.INSTANCE));
            assertEquals("nothing", printer.printType(NothingType.INSTANCE));
            assertEquals("T", printer.printType(new TypeParameterType("T")));
            assertEquals("Hashable", printer.printType(new NamedType("typing.Hashable")));
        }

        @Test
        @DisplayName("容器类型使用 typing 大写名")
        void testContainers() {
            assertEquals("Tuple[int, ...]",
                    printer.printType(new HomogeneousContainerType(new NamedType("tuple"), INT)));
            assertEquals("Set[int]",
                    printer.printType(new HomogeneousContainerType(new NamedType("set"), INT)));
            assertEquals("Tuple[int, str]",
                    printer.printType(new TupleType(new NamedType("tuple"), Arrays.<StubType>asList(INT, STR))));
            assertEquals("Dict[str, int]",
                    printer.printType(new GenericType(new NamedType("dict"), Arrays.<StubType>asList(STR, INT))));
            assertEquals("foo.Box[int]",
                    printer.printType(new GenericType(new NamedType("foo.Box"), Collections.<StubType>singletonList(INT))));
        }

        @Test
        @DisplayName("Callable 与联合")
        void testCallableAndUnion() {
            assertEquals("Callable[[int], str]", printer.printType(
                    new CallableType(new NamedType("typing.Callable"), Collections.<StubType>singletonList(INT), STR)));
            assertEquals("Optional[int]",
                    printer.printType(UnionType.of(Arrays.<StubType>asList(NamedType.NONE, INT))));
            assertEquals("Union[int, str]",
                    printer.printType(UnionType.of(Arrays.<StubType>asList(INT, STR, INT))));
        }
    }
}
