package com.stubkit.compiler.ast.decl;

import com.stubkit.compiler.ast.AstVisitor;
import com.stubkit.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * from M import a[ as b], ... 或 from M import *
 */
public class FromImportDecl extends Declaration {
    private final QualifiedName module;
    private final List<ImportedName> names;
    private final boolean wildcard;

    public FromImportDecl(SourceLocation location, QualifiedName module, List<ImportedName> names) {
        super(location);
        this.module = module;
        this.names = names;
        this.wildcard = false;
    }

    /** from M import * */
    public FromImportDecl(SourceLocation location, QualifiedName module) {
        super(location);
        this.module = module;
        this.names = Collections.emptyList();
        this.wildcard = true;
    }

    public QualifiedName getModule() {
        return module;
    }

    public List<ImportedName> getNames() {
        return names;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFromImportDecl(this, context);
    }

    /**
     * 导入项
     */
    public static final class ImportedName {
        private final String name;
        private final String alias;  // 可选

        public ImportedName(String name, String alias) {
            this.name = name;
            this.alias = alias;
        }

        public String getName() {
            return name;
        }

        public String getAlias() {
            return alias;
        }

        /** 绑定到当前模块的名称 */
        public String getBoundName() {
            return alias != null ? alias : name;
        }
    }
}
