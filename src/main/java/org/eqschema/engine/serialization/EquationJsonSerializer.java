package org.eqschema.engine.serialization;

import org.eqschema.dsl.AbsoluteValue;
import org.eqschema.dsl.Constant;
import org.eqschema.dsl.Expression;
import org.eqschema.dsl.FunctionCall;
import org.eqschema.dsl.FunctionDef;
import org.eqschema.dsl.Piecewise;
import org.eqschema.dsl.Power;
import org.eqschema.dsl.Product;
import org.eqschema.dsl.Relational;
import org.eqschema.dsl.Sum;
import org.eqschema.dsl.Variable;
import org.eqschema.engine.EquationDocument;
import org.eqschema.engine.EquationRecord;

import java.io.IOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes equation records in the canonical JSON schema.
 *
 * Output format:
 * <pre>
 * {
 *   "source_file": "equations.txt",
 *   "count": 1,
 *   "equations": [
 *     {
 *       "id": 1,
 *       "raw": "2*x + 3 = 7",
 *       "variables": ["x"],
 *       "equation_type": "linear",
 *       "relation": "=",
 *       "lhs": {"type": "sum", "terms": [...]},
 *       "rhs": {"type": "constant", "value": 7}
 *     }
 *   ]
 * }
 * </pre>
 *
 * Expression nodes are objects tagged by "type": constant, variable, sum,
 * product, power, absolute_value, function_call, relational, function_def,
 * piecewise.
 */
public final class EquationJsonSerializer {

    private final boolean pretty;

    public EquationJsonSerializer(boolean pretty) {
        this.pretty = pretty;
    }

    public String serialize(EquationDocument document) {
        return JsonWriter.write(toJson(document), pretty);
    }

    public String serialize(EquationRecord record) {
        return JsonWriter.write(toJson(record), pretty);
    }

    public String serialize(Expression expression) {
        return JsonWriter.write(toJson(expression), pretty);
    }

    public void write(EquationDocument document, Writer out) throws IOException {
        out.write(serialize(document));
        if (pretty) {
            out.write('\n');
        }
    }

    static Map<String, Object> toJson(EquationDocument document) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("source_file", document.sourceFile());
        json.put("count", document.count());
        json.put("equations", document.equations().stream().map(EquationJsonSerializer::toJson).toList());
        return json;
    }

    static Map<String, Object> toJson(EquationRecord record) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", record.id());
        json.put("raw", record.raw());
        json.put("variables", record.variables());
        json.put("equation_type", record.equationType().id());
        json.put("relation", record.relation().symbol());
        json.put("lhs", toJson(record.lhs()));
        json.put("rhs", toJson(record.rhs()));
        return json;
    }

    static Map<String, Object> toJson(Expression expression) {
        Map<String, Object> json = new LinkedHashMap<>();
        if (expression instanceof Constant constant) {
            json.put("type", "constant");
            json.put("value", number(constant));
        } else if (expression instanceof Variable variable) {
            json.put("type", "variable");
            json.put("name", variable.name());
        } else if (expression instanceof Sum sum) {
            json.put("type", "sum");
            json.put("terms", toJson(sum.terms()));
        } else if (expression instanceof Product product) {
            json.put("type", "product");
            json.put("factors", toJson(product.factors()));
        } else if (expression instanceof Power power) {
            json.put("type", "power");
            json.put("base", toJson(power.base()));
            json.put("exponent", toJson(power.exponent()));
        } else if (expression instanceof AbsoluteValue abs) {
            json.put("type", "absolute_value");
            json.put("operand", toJson(abs.operand()));
        } else if (expression instanceof FunctionCall call) {
            json.put("type", "function_call");
            json.put("name", call.name());
            json.put("arguments", toJson(call.arguments()));
        } else if (expression instanceof Relational relational) {
            json.put("type", "relational");
            json.put("relation", relational.relation().symbol());
            json.put("lhs", toJson(relational.lhs()));
            json.put("rhs", toJson(relational.rhs()));
        } else if (expression instanceof FunctionDef def) {
            json.put("type", "function_def");
            json.put("name", def.name());
            json.put("variable", def.variable());
        } else if (expression instanceof Piecewise piecewise) {
            json.put("type", "piecewise");
            json.put("branches", piecewise.branches().stream().map(branch -> {
                Map<String, Object> branchJson = new LinkedHashMap<>();
                branchJson.put("condition", toJson(branch.condition()));
                branchJson.put("expression", toJson(branch.expression()));
                return branchJson;
            }).toList());
        } else {
            throw new IllegalArgumentException("Unknown expression node: " + expression);
        }
        return json;
    }

    private static List<Map<String, Object>> toJson(List<Expression> expressions) {
        return expressions.stream().map(EquationJsonSerializer::toJson).toList();
    }

    // Integral constants are written as integers: 2, not 2.0
    private static Number number(Constant constant) {
        double value = constant.value();
        if (constant.isInteger() && Math.abs(value) < 0x1p53) {
            return (long) value;
        }
        return value;
    }
}
