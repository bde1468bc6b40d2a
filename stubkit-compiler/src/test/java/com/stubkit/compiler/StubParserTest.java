package com.stubkit.compiler;

import com.stubkit.compiler.model.Function;
import com.stubkit.compiler.model.FunctionKind;
import com.stubkit.compiler.model.StubClass;
import com.stubkit.compiler.model.StubModule;
import com.stubkit.compiler.model.type.NamedType;
import com.stubkit.compiler.parser.ParseError;
import com.stubkit.compiler.parser.ParseResult;
import com.stubkit.compiler.printer.StubPrinter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端测试：源码 → 模型 → 规范文本
 */
class StubParserTest {

    private final StubPrinter printer = new StubPrinter();

    private StubModule module(String source, ParseOptions options) {
        ParseResult result = StubParser.parse(source, options);
        assertTrue(result.isSuccess(), () -> "Unexpected failure: " + result.getError());
        return result.getModule();
    }

    private String print(String source, ParseOptions options) {
        return printer.print(module(source, options));
    }

    private String print(String source) {
        return print(source, ParseOptions.defaults());
    }

    /** 检查打印结果，并确认规范文本再解析后保持不变 */
    private void check(String source, String expected) {
        assertEquals(expected, print(source));
        assertEquals(expected, print(expected), "Canonical output is not stable");
    }

    /** 源码本身已是规范文本 */
    private void check(String source) {
        check(source, source);
    }

    private ParseError error(String source) {
        ParseResult result = StubParser.parse(source, ParseOptions.builder().filename("foo.pyi").build());
        assertFalse(result.isSuccess(), "Expected failure for: " + source);
        return result.getError();
    }

    private void checkError(String source, Integer line, String message) {
        ParseError error = error(source);
        assertEquals(message, error.getMessage());
        assertEquals(line, error.getLine());
    }

    @Nested
    @DisplayName("常量")
    class ConstantTests {

        @Test
        @DisplayName("类型注释、0 与布尔字面量")
        void testConstants() {
            check("x = ...  # type: int\ny = 0\nz = True",
                    "x = ...  # type: int\ny = ...  # type: int\nz = ...  # type: bool");
        }

        @Test
        @DisplayName("缺少类型时为 Any")
        void testMissingType() {
            check("x = ...", "from typing import Any\n\nx = ...  # type: Any");
        }

        @Test
        @DisplayName("下一行的类型注释")
        void testTypeCommentOnNextLine() {
            check("x = ...\n# type: str\n", "x = ...  # type: str");
        }

        @Test
        @DisplayName("变量注解")
        void testAnnotation() {
            check("x: List[int]", "from typing import List\n\nx = ...  # type: List[int]");
        }

        @Test
        @DisplayName("点号类型生成 import")
        void testDottedType() {
            check("x = ...  # type: foo.bar.Baz", "import foo.bar\n\nx = ...  # type: foo.bar.Baz");
        }

        @Test
        @DisplayName("typing 成员去掉前缀")
        void testTypingMember() {
            check("x = ...  # type: typing.Hashable", "from typing import Hashable\n\nx = ...  # type: Hashable");
        }
    }

    @Nested
    @DisplayName("类型规范化")
    class TypeTests {

        @Test
        @DisplayName("元组的各种写法")
        void testTuples() {
            check("a = ...  # type: Tuple[int, ...]\n"
                            + "b = ...  # type: Tuple[int, str]\n"
                            + "c = ...  # type: List[int, ...]\n"
                            + "d = ...  # type: []",
                    "from typing import List, Tuple\n\n"
                            + "a = ...  # type: Tuple[int, ...]\n"
                            + "b = ...  # type: Tuple[int, str]\n"
                            + "c = ...  # type: List[int]\n"
                            + "d = ...  # type: Tuple[nothing, ...]");
        }

        @Test
        @DisplayName("or 联合与问号")
        void testOrAndQuestion() {
            check("x = ...  # type: int or str", "from typing import Union\n\nx = ...  # type: Union[int, str]");
            check("x = ...  # type: ?", "from typing import Any\n\nx = ...  # type: Any");
        }

        @Test
        @DisplayName("联合展开、去重、含 None 时打印为 Optional")
        void testUnions() {
            check("x = ...  # type: Union[int, Union[str, int]]",
                    "from typing import Union\n\nx = ...  # type: Union[int, str]");
            check("x = ...  # type: Optional[int]", "from typing import Optional\n\nx = ...  # type: Optional[int]");
            check("x = ...  # type: Union[int, None, str]",
                    "from typing import Optional, Union\n\nx = ...  # type: Optional[Union[int, str]]");
        }

        @Test
        @DisplayName("Callable")
        void testCallable() {
            check("from typing import Callable\nx = ...  # type: Callable[[int, str], bool]",
                    "from typing import Callable\n\nx = ...  # type: Callable[[int, str], bool]");
            check("from typing import Callable\nx = ...  # type: Callable[..., int]",
                    "from typing import Any, Callable\n\nx = ...  # type: Callable[Any, int]");
            check("from typing import Callable\nx = ...  # type: Callable[[nothing], int]",
                    "from typing import Callable\n\nx = ...  # type: Callable[[], int]");
        }

        @Test
        @DisplayName("Callable 省略返回类型或返回 ... 时为 Any")
        void testCallableDefaultReturn() {
            check("from typing import Callable\nx = ...  # type: Callable[[int]]",
                    "from typing import Any, Callable\n\nx = ...  # type: Callable[[int], Any]");
            check("from typing import Callable\nx = ...  # type: Callable[[], ...]",
                    "from typing import Any, Callable\n\nx = ...  # type: Callable[[], Any]");
        }

        @Test
        @DisplayName("NamedTuple 合成类")
        void testNamedTuple() {
            check("x = ...  # type: NamedTuple('Point', [('x', int), ('y', str)])",
                    "from typing import Tuple\n\n"
                            + "x = ...  # type: `Point`\n\n"
                            + "class `Point`(Tuple[int, str]):\n"
                            + "    x = ...  # type: int\n"
                            + "    y = ...  # type: str\n");
        }

        @Test
        @DisplayName("同名 NamedTuple 依次编号")
        void testNamedTupleCounter() {
            StubModule module = module("a = ...  # type: NamedTuple('P', [])\n"
                    + "b = ...  # type: NamedTuple('P', [])\n", ParseOptions.defaults());
            assertEquals(2, module.getClasses().size());
            assertEquals("`P`", module.getClasses().get(0).getName());
            assertEquals("`P~1`", module.getClasses().get(1).getName());
        }

        @Test
        @DisplayName("类型错误")
        void testTypeErrors() {
            checkError("x = ...  # type: Union[]", 1, "Missing options to typing.Union");
            checkError("x = ...  # type: Optional[int, str]", 1, "Expected 1 parameter to typing.Optional, got 2");
            checkError("x = ...  # type: Tuple[..., int]", 1,
                    "ellipsis (...) not supported before the last type parameter");
            checkError("x = ...  # type: Tuple[int, ..., ...]", 1, "[..., ...] not supported");
            checkError("x = ...  # type: Callable[int, str]", 1,
                    "First argument to Callable must be a list of argument types");
            checkError("x = ...  # type: Callable[[int], str, bool]", 1,
                    "Expected 2 parameters to Callable, got 3");
        }
    }

    @Nested
    @DisplayName("函数")
    class FunctionTests {

        @Test
        @DisplayName("参数与返回类型")
        void testSimple() {
            check("def foo(x: int, y: str = ...) -> List[int]: ...",
                    "from typing import List\n\ndef foo(x: int, y: str = ...) -> List[int]: ...");
        }

        @Test
        @DisplayName("默认值推断类型")
        void testDefaultInference() {
            check("def f(x=0, y=1.5, z=True, w=...) -> None: ...",
                    "def f(x: int = ..., y: float = ..., z: bool = ..., w = ...) -> None: ...");
        }

        @Test
        @DisplayName("默认值为 None 时类型变为 Optional")
        void testNoneDefault() {
            check("def f(x: int = None) -> str: ...",
                    "from typing import Optional\n\ndef f(x: Optional[int] = ...) -> str: ...");
            check("def f(x: Union[int, str] = None) -> None: ...",
                    "from typing import Optional, Union\n\ndef f(x: Optional[Union[int, str]] = ...) -> None: ...");
        }

        @Test
        @DisplayName("缺少返回类型时为 Any")
        void testMissingReturnType() {
            check("def f(x): ...", "from typing import Any\n\ndef f(x) -> Any: ...");
        }

        @Test
        @DisplayName("*args 与 **kwargs")
        void testStarArgs() {
            check("def f(x, *args: float, **kwargs: int) -> None: ...",
                    "from typing import Dict, Tuple\n\ndef f(x, *args: float, **kwargs: int) -> None: ...");
        }

        @Test
        @DisplayName("仅关键字参数")
        void testKeywordOnly() {
            check("def f(x, *, y: int, z: str = ...) -> None: ...");
            check("def f(*args, y) -> None: ...");
        }

        @Test
        @DisplayName("省略号参数等价于 *args, **kwargs")
        void testEllipsisParameter() {
            check("def f(x, ...) -> None: ...", "def f(x, *args, **kwargs) -> None: ...");
        }

        @Test
        @DisplayName("raise 与 mutator")
        void testBody() {
            check("def f(x: list) -> None:\n    raise Bar.Error()\n    x := List[int]\n",
                    "import Bar\n\ndef f(x: list) -> None:\n    raise Bar.Error()\n    x := List[int]");
        }

        @Test
        @DisplayName("重载保持声明顺序")
        void testOverloads() {
            check("def f(x: int) -> int: ...\ndef g() -> None: ...\ndef f(x: str) -> str: ...",
                    "def f(x: int) -> int: ...\ndef f(x: str) -> str: ...\ndef g() -> None: ...");
        }

        @Test
        @DisplayName("overload 与 abstractmethod 被忽略")
        void testNoOpDecorators() {
            check("@overload\ndef f(x: int) -> int: ...\n@abstractmethod\ndef f(x: str) -> str: ...",
                    "def f(x: int) -> int: ...\ndef f(x: str) -> str: ...");
        }

        @Test
        @DisplayName("PYTHONCODE")
        void testExternal() {
            check("def f PYTHONCODE");
            Function f = module("def f PYTHONCODE", ParseOptions.defaults()).findFunction("f");
            assertTrue(f.isExternal());
            assertTrue(f.getSignatures().isEmpty());
        }

        @Test
        @DisplayName("参数错误")
        void testParameterErrors() {
            checkError("def f(x, *, ...) -> None: ...", 1, "ellipsis (...) not compatible with bare *");
            checkError("def f(..., x) -> None: ...", 1, "ellipsis (...) must be last parameter");
            checkError("def f(*, **kw) -> None: ...", 1, "Named arguments must follow bare *");
            checkError("def f(*a, *b) -> None: ...", 1, "Unexpected second *");
            checkError("def f(**kw, x) -> None: ...", 1, "**kw must be last parameter");
            checkError("x = ...\ndef f(x) -> None:\n    y := int\n", 2, "No parameter named y");
        }

        @Test
        @DisplayName("PYTHONCODE 不能与其他定义混用")
        void testExternalErrors() {
            checkError("def f PYTHONCODE\ndef f PYTHONCODE", null, "Multiple PYTHONCODEs for f");
            checkError("def f PYTHONCODE\ndef f() -> int: ...", null, "Mixed pytd and PYTHONCODEs for f");
        }

        @Test
        @DisplayName("模块级装饰器错误")
        void testModuleDecoratorErrors() {
            checkError("@foo\ndef f() -> None: ...", null, "Unhandled decorator: foo");
            checkError("@property\ndef f(self) -> int: ...", null,
                    "Module-level functions with property decorators: f");
        }
    }

    @Nested
    @DisplayName("类")
    class ClassTests {

        @Test
        @DisplayName("父类、metaclass、常量和方法")
        void testFullClass() {
            check("class A(B, metaclass=M):\n"
                    + "    x = ...  # type: int\n"
                    + "    def f(self) -> int: ...\n"
                    + "    @staticmethod\n"
                    + "    def g() -> None: ...\n"
                    + "    @classmethod\n"
                    + "    def h(cls) -> None: ...\n");
        }

        @Test
        @DisplayName("空类打印 pass")
        void testEmptyClass() {
            check("class A: ...", "class A:\n    pass\n");
        }

        @Test
        @DisplayName("nothing 父类被丢弃")
        void testNothingParent() {
            check("class A(nothing): ...", "class A:\n    pass\n");
        }

        @Test
        @DisplayName("属性合并为常量")
        void testProperty() {
            check("class A:\n"
                            + "    @property\n"
                            + "    def x(self) -> int: ...\n"
                            + "    @x.setter\n"
                            + "    def x(self, v: int) -> None: ...\n"
                            + "    @x.deleter\n"
                            + "    def x(self) -> None: ...\n",
                    "class A:\n    x = ...  # type: int\n");
        }

        @Test
        @DisplayName("__new__ 隐式为静态方法且不打印装饰器")
        void testNew() {
            check("class A:\n    def __new__(cls) -> A: ...\n");
            StubClass cls = module("class A:\n    def __new__(cls) -> A: ...\n", ParseOptions.defaults()).findClass("A");
            assertEquals(FunctionKind.STATICMETHOD, cls.findMethod("__new__").getKind());
        }

        @Test
        @DisplayName("类体别名复制常量类型")
        void testClassAlias() {
            check("class A:\n    x = ...  # type: int\n    y = x\n",
                    "class A:\n    x = ...  # type: int\n    y = ...  # type: int\n");
        }

        @Test
        @DisplayName("前向引用本地类")
        void testForwardReference() {
            check("def f() -> A: ...\nclass A: ...", "class A:\n    pass\n\n\ndef f() -> A: ...");
        }

        @Test
        @DisplayName("类内错误报告在类声明行")
        void testClassErrors() {
            checkError("x = ...\nclass A:\n    @foo\n    def f(self) -> None: ...\n", 2, "Unhandled decorator: foo");
            checkError("class A:\n    @property\n    def x(self) -> int: ...\n    def x(self) -> int: ...\n",
                    1, "Incompatible signatures for x");
            checkError("class A:\n    x = ...  # type: int\n    def x(self) -> int: ...\n",
                    1, "Duplicate identifier(s): x");
            checkError("class A:\n    y = z\n", 1, "Illegal value for alias 'y'");
            checkError("class A:\n    def f(self) -> int: ...\n    @classmethod\n    def f(cls) -> int: ...\n",
                    1, "Overloaded signatures for f disagree on decorators");
            checkError("class A:\n    @property\n    def x(self, y) -> int: ...\n", 1, "Unhandled decorator: property");
        }

        @Test
        @DisplayName("装饰器过多报告在 def 行")
        void testTooManyDecorators() {
            checkError("class A:\n    @classmethod\n    @staticmethod\n    def f() -> None: ...\n",
                    4, "Too many decorators for f");
        }
    }

    @Nested
    @DisplayName("别名、导入与 TypeVar")
    class AliasTests {

        @Test
        @DisplayName("from 导入打印为 from 行")
        void testFromImport() {
            check("from foo import Bar\nX = Bar", "from foo import Bar\nfrom foo import Bar as X");
        }

        @Test
        @DisplayName("从 typing 导入不产生别名")
        void testTypingImport() {
            check("from typing import List\nx = ...  # type: List[int]",
                    "from typing import List\n\nx = ...  # type: List[int]");
        }

        @Test
        @DisplayName("类型别名")
        void testTypeAlias() {
            check("X = Union[int, str]", "from typing import Union\n\nX = Union[int, str]");
        }

        @Test
        @DisplayName("TypeVar 与约束")
        void testTypeVar() {
            check("T = TypeVar('T')\nS = TypeVar('S', int, str)\ndef f(x: T) -> S: ...",
                    "from typing import TypeVar\n\nT = TypeVar('T')\nS = TypeVar('S', int, str)\n\n"
                            + "def f(x: T) -> S: ...");
        }

        @Test
        @DisplayName("TypeVar 名称必须一致")
        void testTypeVarName() {
            checkError("T = TypeVar('S')", 1, "TypeVar name needs to be 'S' (not 'T')");
        }

        @Test
        @DisplayName("顶层重名")
        void testModuleDuplicates() {
            checkError("x = ...  # type: int\ndef x() -> int: ...", null, "Duplicate top-level identifier(s): x");
        }
    }

    @Nested
    @DisplayName("条件块")
    class ConditionTests {

        private static final String VERSIONED =
                "if sys.version_info >= (3,):\n  x = ...  # type: int\nelse:\n  x = ...  # type: str\n";

        @Test
        @DisplayName("按目标版本选择分支")
        void testVersion() {
            assertEquals("x = ...  # type: str", print(VERSIONED));
            assertEquals("x = ...  # type: int",
                    print(VERSIONED, ParseOptions.builder().targetVersion(3, 6).build()));
        }

        @Test
        @DisplayName("按平台选择分支")
        void testPlatform() {
            String source = "if sys.platform == 'win32':\n  def f() -> int: ...\nelif sys.platform == 'linux':\n"
                    + "  def f() -> str: ...\n";
            assertEquals("def f() -> str: ...", print(source));
            assertEquals("def f() -> int: ...",
                    print(source, ParseOptions.builder().targetPlatform("win32").build()));
            assertEquals("", print(source, ParseOptions.builder().targetPlatform("darwin").build()));
        }

        @Test
        @DisplayName("类体中的条件块")
        void testInsideClass() {
            check("class A:\n  if sys.version_info[0] == 2:\n    x = ...  # type: int\n",
                    "class A:\n    x = ...  # type: int\n");
        }

        @Test
        @DisplayName("死分支中的类不登记为本地类")
        void testDeadClassNotRegistered() {
            String source = "if sys.platform == 'win32':\n  class A: ...\ndef f() -> A: ...";
            assertEquals("def foo.f() -> A: ...", print(source, ParseOptions.builder().name("foo").build()));
        }

        @Test
        @DisplayName("死分支中的语义错误被忽略")
        void testDeadBranchErrorsIgnored() {
            assertEquals("", print("if sys.version_info >= (3,):\n  T = TypeVar('S')\n"));
        }

        @Test
        @DisplayName("超出 int 范围的版本下标报错")
        void testHugeVersionIndex() {
            checkError("if sys.version_info[4294967296] == 2:\n  x = ...  # type: int\n", 1,
                    "tuple index out of range");
        }

        @Test
        @DisplayName("同一行嵌套过深返回错误结果")
        void testDeepSingleLineChain() {
            StringBuilder source = new StringBuilder();
            for (int i = 0; i < 50000; i++) source.append("if sys.platform == 'linux': ");
            source.append("x = ...  # type: int\n");
            ParseError error = error(source.toString());
            assertEquals("Nesting too deep", error.getMessage());
        }

        @Test
        @DisplayName("很长的 or 链可以解析")
        void testLongOrChain() {
            StringBuilder source = new StringBuilder("if sys.platform == 'a'");
            for (int i = 0; i < 50000; i++) source.append(" or sys.platform == 'a'");
            source.append(":\n  x = ...  # type: int\n");
            assertEquals("", print(source.toString()));
        }
    }

    @Nested
    @DisplayName("模块名")
    class ModuleNameTests {

        @Test
        @DisplayName("显式模块名为顶层名称加前缀")
        void testExplicitName() {
            String source = "x = ...  # type: int\nclass A: ...\ndef f(a: A) -> None: ...";
            StubModule module = module(source, ParseOptions.builder().name("foo").build());
            assertEquals("foo", module.getName());
            assertNotNull(module.findClass("foo.A"));
            assertEquals("foo.x = ...  # type: int\n\nclass foo.A:\n    pass\n\n\ndef foo.f(a: foo.A) -> None: ...",
                    printer.print(module));
        }

        @Test
        @DisplayName("TypeVar 不加前缀")
        void testTypeVarNotQualified() {
            StubModule module = module("T = TypeVar('T')", ParseOptions.builder().name("foo").build());
            assertEquals("T", module.getTypeParameters().get(0).getName());
        }

        @Test
        @DisplayName("默认模块名为源码 MD5")
        void testDigestName() {
            assertEquals("d41d8cd98f00b204e9800998ecf8427e", StubParser.digest(""));
            StubModule module = module("x = ...", ParseOptions.defaults());
            assertEquals(StubParser.digest("x = ..."), module.getName());
            assertEquals(32, module.getName().length());
        }
    }

    @Nested
    @DisplayName("错误结果")
    class ErrorTests {

        @Test
        @DisplayName("词法错误带源码行和插入符")
        void testLexError() {
            ParseError error = error("x = ...\ny = ^");
            assertEquals("  File: \"foo.pyi\", line 2\n"
                    + "    y = ^\n"
                    + "        ^\n"
                    + "ParseError: Illegal character '^'", error.toString());
        }

        @Test
        @DisplayName("语法错误列号相对未去缩进的行")
        void testSyntaxError() {
            ParseError error = error("class Foo:\n  this is not valid");
            assertEquals(Integer.valueOf(2), error.getLine());
            assertEquals(Integer.valueOf(8), error.getColumn());
            assertEquals("  this is not valid", error.getText());
            assertEquals("syntax error, unexpected NAME, expecting ':' or '='", error.getMessage());
            assertEquals("         ^", error.toLines().get(2));
        }

        @Test
        @DisplayName("空模块")
        void testEmpty() {
            StubModule module = module("", ParseOptions.defaults());
            assertTrue(module.isEmpty());
            assertEquals("", printer.print(module));
        }
    }

    @Nested
    @DisplayName("确定性")
    class DeterminismTests {

        @Test
        @DisplayName("重复解析得到相等的模块")
        void testRepeatable() {
            String source = "a = ...  # type: NamedTuple('P', [('x', int)])\nclass A:\n    def f(self) -> int: ...\n";
            assertEquals(module(source, ParseOptions.defaults()), module(source, ParseOptions.defaults()));
        }

        @Test
        @DisplayName("连续解析之间不残留状态")
        void testNoStateBetweenParses() {
            String source = "a = ...  # type: NamedTuple('P', [('x', int)])\n";
            for (int i = 0; i < 3; i++) {
                assertEquals("`P`", module(source, ParseOptions.defaults()).getClasses().get(0).getName());
                error("b = ...  # type: NamedTuple('P', [])\nb = ...  # type: int\n");
            }
        }

        @Test
        @DisplayName("流水线中的静态字段都是不可变的常量表")
        void testNoMutableStaticState() throws Exception {
            String[] classNames = {
                    "com.stubkit.compiler.StubParser",
                    "com.stubkit.compiler.lexer.Lexer",
                    "com.stubkit.compiler.parser.Parser",
                    "com.stubkit.compiler.analysis.NameRegistry",
                    "com.stubkit.compiler.analysis.SynthesizedClassNamer",
                    "com.stubkit.compiler.analysis.Decorator",
                    "com.stubkit.compiler.analysis.ParseContext",
                    "com.stubkit.compiler.analysis.TypeNormalizer",
                    "com.stubkit.compiler.analysis.SignatureBuilder",
                    "com.stubkit.compiler.analysis.TargetEnvironment",
                    "com.stubkit.compiler.printer.StubPrinter",
            };
            for (String className : classNames) {
                for (Field field : Class.forName(className).getDeclaredFields()) {
                    if (!Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                        continue;
                    }
                    assertTrue(Modifier.isFinal(field.getModifiers()), className + "." + field.getName());
                    field.setAccessible(true);
                    Object value = field.get(null);
                    if (value instanceof Map) {
                        Map<?, ?> map = (Map<?, ?>) value;
                        assertThrows(UnsupportedOperationException.class, map::clear,
                                className + "." + field.getName());
                    } else if (value instanceof Collection) {
                        Collection<?> collection = (Collection<?>) value;
                        assertThrows(UnsupportedOperationException.class, collection::clear,
                                className + "." + field.getName());
                    }
                }
            }
        }

        @Test
        @DisplayName("内置存根样例可以解析且规范输出稳定")
        void testBuiltinsSample() throws IOException {
            String source = resource("builtins_sample.pyi");
            StubModule module = module(source, ParseOptions.defaults());
            assertNotNull(module.findClass("object"));
            assertNotNull(module.findClass("list"));
            assertEquals(new NamedType("object"), module.findClass("int").getParents().get(0));
            assertNotNull(module.findFunction("len"));

            String canonical = printer.print(module);
            assertEquals(canonical, print(canonical));
        }

        private String resource(String name) throws IOException {
            try (InputStream in = StubParserTest.class.getResourceAsStream("/" + name)) {
                assertNotNull(in, "Missing resource " + name);
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
    }
}
