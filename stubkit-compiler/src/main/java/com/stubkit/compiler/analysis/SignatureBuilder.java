package com.stubkit.compiler.analysis;

import com.stubkit.compiler.ast.Literal;
import com.stubkit.compiler.ast.decl.Annotation;
import com.stubkit.compiler.ast.decl.FunDecl;
import com.stubkit.compiler.ast.stmt.MutatorStmt;
import com.stubkit.compiler.ast.stmt.RaiseStmt;
import com.stubkit.compiler.ast.stmt.Statement;
import com.stubkit.compiler.model.FunctionKind;
import com.stubkit.compiler.model.Parameter;
import com.stubkit.compiler.model.Signature;
import com.stubkit.compiler.model.type.AnythingType;
import com.stubkit.compiler.model.type.GenericType;
import com.stubkit.compiler.model.type.HomogeneousContainerType;
import com.stubkit.compiler.model.type.NamedType;
import com.stubkit.compiler.model.type.StubType;
import com.stubkit.compiler.model.type.UnionType;
import com.stubkit.compiler.parser.ParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 把单个 def 转换为一个签名定义，合并由 {@link SignatureMerger} 完成
 */
public final class SignatureBuilder {
    private static final NamedType TUPLE = new NamedType("tuple");
    private static final NamedType DICT = new NamedType("dict");
    private static final NamedType STR = new NamedType("str");

    private final TypeNormalizer normalizer;

    public SignatureBuilder(TypeNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * 单个 def 的中间结果
     */
    public static final class Definition {
        private final String name;
        private final Decorator decorator;  // 去掉 overload/abstractmethod 后剩余的装饰器，可为 null
        private final Signature signature;  // external 时为 null
        private final boolean external;
        private final int line;

        Definition(String name, Decorator decorator, Signature signature, boolean external, int line) {
            this.name = name;
            this.decorator = decorator;
            this.signature = signature;
            this.external = external;
            this.line = line;
        }

        public String getName() {
            return name;
        }

        public Decorator getDecorator() {
            return decorator;
        }

        public Signature getSignature() {
            return signature;
        }

        public boolean isExternal() {
            return external;
        }

        public int getLine() {
            return line;
        }

        /** 由装饰器和方法名推导出的函数种类 */
        public FunctionKind getKind() {
            if ("__new__".equals(name)) {
                return FunctionKind.STATICMETHOD;
            }
            if (decorator != null && decorator.getKind() == Decorator.Kind.CLASSMETHOD) {
                return FunctionKind.CLASSMETHOD;
            }
            if (decorator != null && decorator.getKind() == Decorator.Kind.STATICMETHOD) {
                return FunctionKind.STATICMETHOD;
            }
            return FunctionKind.METHOD;
        }
    }

    public Definition build(FunDecl decl) {
        int line = decl.getLine();
        Decorator decorator = recognizeDecorator(decl, line);
        if (decl.isExternal()) {
            return new Definition(decl.getName(), decorator, null, true, line);
        }
        return new Definition(decl.getName(), decorator, buildSignature(decl, line), false, line);
    }

    private static Decorator recognizeDecorator(FunDecl decl, int line) {
        Decorator result = null;
        for (Annotation annotation : decl.getDecorators()) {
            Decorator decorator = Decorator.recognize(annotation.getText());
            if (decorator.isNoOp()) {
                continue;
            }
            if (result != null) {
                throw new ParseException("Too many decorators for " + decl.getName(), line);
            }
            result = decorator;
        }
        return result;
    }

    private Signature buildSignature(FunDecl decl, int line) {
        List<Parameter> params = new ArrayList<Parameter>();
        Parameter starargs = null;
        Parameter starstarargs = null;
        boolean seenStar = false;
        boolean bareStar = false;
        boolean namedAfterBareStar = false;

        List<com.stubkit.compiler.ast.decl.Parameter> raw = decl.getParams();
        for (int i = 0; i < raw.size(); i++) {
            com.stubkit.compiler.ast.decl.Parameter p = raw.get(i);
            if (starstarargs != null) {
                throw new ParseException("**" + starstarargs.getName() + " must be last parameter", line);
            }
            switch (p.getKind()) {
                case ELLIPSIS:
                    if (i != raw.size() - 1) {
                        throw new ParseException("ellipsis (...) must be last parameter", line);
                    }
                    if (bareStar) {
                        throw new ParseException("ellipsis (...) not compatible with bare *", line);
                    }
                    // f(x, ...) 等价于 f(x, *args, **kwargs)
                    if (starargs == null) {
                        starargs = new Parameter("args", null);
                    }
                    starstarargs = new Parameter("kwargs", null);
                    break;
                case BARE_STAR:
                case STAR:
                    if (seenStar) {
                        throw new ParseException("Unexpected second *", line);
                    }
                    seenStar = true;
                    if (p.getKind() == com.stubkit.compiler.ast.decl.Parameter.Kind.BARE_STAR) {
                        bareStar = true;
                    } else {
                        StubType element = p.getType() != null ? normalizer.normalize(p.getType()) : null;
                        starargs = new Parameter(p.getName(),
                                element != null ? new HomogeneousContainerType(TUPLE, element) : null);
                    }
                    break;
                case DOUBLE_STAR:
                    StubType value = p.getType() != null ? normalizer.normalize(p.getType()) : null;
                    starstarargs = new Parameter(p.getName(),
                            value != null ? new GenericType(DICT, Arrays.<StubType>asList(STR, value)) : null);
                    break;
                default:
                    if (bareStar) {
                        namedAfterBareStar = true;
                    }
                    params.add(buildParameter(p, seenStar));
                    break;
            }
        }
        if (bareStar && !namedAfterBareStar) {
            throw new ParseException("Named arguments must follow bare *", line);
        }

        StubType returnType = decl.getReturnType() != null
                ? normalizer.normalize(decl.getReturnType()) : AnythingType.INSTANCE;

        List<StubType> exceptions = new ArrayList<StubType>();
        for (Statement stmt : decl.getBody()) {
            if (stmt instanceof RaiseStmt) {
                exceptions.add(normalizer.normalize(((RaiseStmt) stmt).getException()));
            } else if (stmt instanceof MutatorStmt) {
                applyMutator(params, (MutatorStmt) stmt, line);
            }
        }
        return new Signature(params, starargs, starstarargs, returnType, exceptions);
    }

    private Parameter buildParameter(com.stubkit.compiler.ast.decl.Parameter p, boolean kwonly) {
        Literal defaultValue = p.getDefaultValue();
        StubType type;
        if (p.getType() != null) {
            type = normalizer.normalize(p.getType());
            // x: T = None → Optional[T]
            if (defaultValue != null && defaultValue.isName("None")) {
                type = UnionType.of(Arrays.<StubType>asList(type, NamedType.NONE));
            }
        } else {
            type = inferFromDefault(defaultValue);
        }
        return new Parameter(p.getName(), type, kwonly, defaultValue != null, null);
    }

    private static StubType inferFromDefault(Literal defaultValue) {
        if (defaultValue == null) {
            return null;
        }
        if (defaultValue.is(Literal.Kind.INT)) {
            return new NamedType("int");
        }
        if (defaultValue.is(Literal.Kind.FLOAT)) {
            return new NamedType("float");
        }
        if (defaultValue.isName("True") || defaultValue.isName("False")) {
            return new NamedType("bool");
        }
        return null;
    }

    private void applyMutator(List<Parameter> params, MutatorStmt mutator, int line) {
        for (int i = 0; i < params.size(); i++) {
            if (params.get(i).getName().equals(mutator.getName())) {
                params.set(i, params.get(i).withMutatedType(normalizer.normalize(mutator.getType())));
                return;
            }
        }
        throw new ParseException("No parameter named " + mutator.getName(), line);
    }
}
