package com.stubkit.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.stubkit.compiler.model.*;
import com.stubkit.compiler.model.type.StubType;
import com.stubkit.compiler.printer.StubPrinter;

import java.util.List;
import java.util.Locale;

/**
 * 把 {@link StubModule} 渲染为 JSON，类型以规范文本表示
 */
class ModuleJson {
    private final Gson gson;
    private final StubPrinter printer = new StubPrinter();

    ModuleJson(boolean pretty) {
        GsonBuilder builder = new GsonBuilder().serializeNulls().disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    String toJson(StubModule module) {
        return gson.toJson(toJsonObject(module));
    }

    JsonObject toJsonObject(StubModule module) {
        JsonObject json = new JsonObject();
        json.addProperty("name", module.getName());

        JsonArray aliases = new JsonArray();
        for (Alias alias : module.getAliases()) {
            JsonObject item = new JsonObject();
            item.addProperty("name", alias.getName());
            item.addProperty("type", type(alias.getType()));
            aliases.add(item);
        }
        json.add("aliases", aliases);
        json.add("constants", constants(module.getConstants()));

        JsonArray typeParameters = new JsonArray();
        for (TypeParameter typeParameter : module.getTypeParameters()) {
            JsonObject item = new JsonObject();
            item.addProperty("name", typeParameter.getName());
            item.add("constraints", types(typeParameter.getConstraints()));
            typeParameters.add(item);
        }
        json.add("typeParameters", typeParameters);

        JsonArray classes = new JsonArray();
        for (StubClass cls : module.getClasses()) {
            JsonObject item = new JsonObject();
            item.addProperty("name", cls.getName());
            item.add("parents", types(cls.getParents()));
            item.addProperty("metaclass", type(cls.getMetaclass()));
            item.add("constants", constants(cls.getConstants()));
            item.add("methods", functions(cls.getMethods()));
            classes.add(item);
        }
        json.add("classes", classes);
        json.add("functions", functions(module.getFunctions()));
        return json;
    }

    private JsonArray constants(List<Constant> constants) {
        JsonArray array = new JsonArray();
        for (Constant constant : constants) {
            JsonObject item = new JsonObject();
            item.addProperty("name", constant.getName());
            item.addProperty("type", type(constant.getType()));
            array.add(item);
        }
        return array;
    }

    private JsonArray functions(List<Function> functions) {
        JsonArray array = new JsonArray();
        for (Function function : functions) {
            JsonObject item = new JsonObject();
            item.addProperty("name", function.getName());
            item.addProperty("kind", function.getKind().name().toLowerCase(Locale.ROOT));
            item.addProperty("external", function.isExternal());
            JsonArray signatures = new JsonArray();
            for (Signature signature : function.getSignatures()) {
                signatures.add(signature(signature));
            }
            item.add("signatures", signatures);
            array.add(item);
        }
        return array;
    }

    private JsonObject signature(Signature signature) {
        JsonObject json = new JsonObject();
        JsonArray params = new JsonArray();
        for (Parameter param : signature.getParams()) {
            params.add(parameter(param));
        }
        json.add("params", params);
        json.add("starargs", signature.getStarargs() != null ? parameter(signature.getStarargs()) : null);
        json.add("starstarargs", signature.getStarstarargs() != null ? parameter(signature.getStarstarargs()) : null);
        json.addProperty("returnType", type(signature.getReturnType()));
        json.add("exceptions", types(signature.getExceptions()));
        return json;
    }

    private JsonObject parameter(Parameter param) {
        JsonObject json = new JsonObject();
        json.addProperty("name", param.getName());
        json.addProperty("type", type(param.getType()));
        json.addProperty("kwonly", param.isKwonly());
        json.addProperty("optional", param.isOptional());
        json.addProperty("mutatedType", type(param.getMutatedType()));
        return json;
    }

    private JsonArray types(List<StubType> types) {
        JsonArray array = new JsonArray();
        for (StubType type : types) {
            array.add(type(type));
        }
        return array;
    }

    private String type(StubType type) {
        return type != null ? printer.printType(type) : null;
    }
}
