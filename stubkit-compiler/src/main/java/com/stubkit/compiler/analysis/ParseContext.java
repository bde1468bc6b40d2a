package com.stubkit.compiler.analysis;

/**
 * 单次解析的全部可变状态（名称表、合成类计数器等），解析结束后即不可达
 */
public final class ParseContext {
    private final String moduleName;
    private final NameRegistry registry;
    private final ConditionEvaluator evaluator;
    private final TypeNormalizer normalizer;
    private final SignatureBuilder signatureBuilder;
    private final SignatureMerger merger;
    private final DuplicateValidator validator;

    /**
     * @param moduleName         模块名（显式给出或内容哈希）
     * @param explicitModuleName 调用方显式给出的模块名，未给出时为 null
     * @param environment        条件求值的目标环境
     */
    public ParseContext(String moduleName, String explicitModuleName, TargetEnvironment environment) {
        this.moduleName = moduleName;
        this.registry = new NameRegistry(explicitModuleName);
        this.evaluator = new ConditionEvaluator(environment);
        this.normalizer = new TypeNormalizer(registry, new SynthesizedClassNamer());
        this.signatureBuilder = new SignatureBuilder(normalizer);
        this.merger = new SignatureMerger();
        this.validator = new DuplicateValidator(registry);
    }

    public String getModuleName() {
        return moduleName;
    }

    public NameRegistry getRegistry() {
        return registry;
    }

    public ConditionEvaluator getEvaluator() {
        return evaluator;
    }

    public TypeNormalizer getNormalizer() {
        return normalizer;
    }

    public SignatureBuilder getSignatureBuilder() {
        return signatureBuilder;
    }

    public SignatureMerger getMerger() {
        return merger;
    }

    public DuplicateValidator getValidator() {
        return validator;
    }
}
