package org.eqschema.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Multiplication of factors. Division by d is stored as a factor Power(d, -1).
 *
 * @param factors Two or more factors, none of them a Product
 */
public record Product(List<Expression> factors) implements Expression {

    public Product {
        Objects.requireNonNull(factors, "Factors cannot be null");
        factors = List.copyOf(factors);
        if (factors.size() < 2) {
            throw new IllegalArgumentException("Product needs at least two factors, use Product.of() to collapse");
        }
    }

    /**
     * Builds the product of the given factors, flattening nested products and
     * collapsing a single factor to itself.
     */
    public static Expression of(List<? extends Expression> factors) {
        List<Expression> flat = new ArrayList<>();
        for (Expression factor : factors) {
            if (factor instanceof Product nested) {
                flat.addAll(nested.factors());
            } else {
                flat.add(factor);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("Product needs at least one factor");
        }
        return flat.size() == 1 ? flat.get(0) : new Product(flat);
    }

    public static Expression of(Expression... factors) {
        return of(List.of(factors));
    }

    /**
     * Negates an expression without introducing a negation node:
     * constants flip sign, a leading constant factor flips sign, anything else
     * gains a leading -1 factor.
     */
    public static Expression negate(Expression expression) {
        if (expression instanceof Constant constant) {
            return constant.negate();
        }
        if (expression instanceof Product product && product.factors().get(0) instanceof Constant lead) {
            List<Expression> factors = new ArrayList<>(product.factors());
            factors.set(0, lead.negate());
            return new Product(factors);
        }
        return of(Constant.MINUS_ONE, expression);
    }
}
