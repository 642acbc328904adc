package net.littleredcomputer.hilbert;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;

/**
 * A named axiom template over the schema variables A, B and C.
 */
public final class AxiomSchema {
    public static final AxiomSchema A1 = new AxiomSchema("A1", "(A → (B → A))", "A", "B");
    public static final AxiomSchema A2 = new AxiomSchema("A2", "((A → (B → C)) → ((A → B) → (A → C)))", "A", "B", "C");
    public static final AxiomSchema A3 = new AxiomSchema("A3", "((¬B → ¬A) → (A → B))", "A", "B");

    /** The schemas of the system, in the order their instances are generated. */
    public static final ImmutableList<AxiomSchema> STANDARD = ImmutableList.of(A1, A2, A3);

    private final String name;
    private final String template;
    private final ImmutableList<String> variables;

    AxiomSchema(String name, String template, String... variables) {
        if (variables.length == 0) throw new IllegalArgumentException("schema " + name + " has no variables");
        for (String v : variables) {
            if (!Substitution.containsVariable(template, v)) {
                throw new IllegalArgumentException("variable " + v + " does not occur in " + template);
            }
        }
        this.name = name;
        this.template = template;
        this.variables = ImmutableList.copyOf(variables);
    }

    public String name() { return name; }
    public String template() { return template; }
    public List<String> variables() { return variables; }

    public String instantiate(Map<String, String> assignment) {
        return Substitution.apply(template, assignment);
    }

    @Override
    public String toString() {
        return name + " " + template;
    }
}
