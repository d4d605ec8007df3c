/**
 *
 */
package org.signalq.logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.sbml.jsbml.ASTNode;

/**
 * This is the base class for a logical activation expression.  An expression is a tree whose leaves are
 * literals and whose internal nodes are AND and OR operators.  A literal tests a species for a required
 * level:  1 if the species must be present, 0 if it must be absent.
 *
 * The same tree can be rendered three ways:  as infix text over species names, as a min/max formula over
 * numeric variable IDs, and as a MathML tree.
 *
 */
public abstract class LogicExpression {

    /**
     * Render this expression as infix text.  AND is "&amp;", OR is "|", and an absent species is preceded by "!".
     *
     * @param names		function that returns the display name for a species ID
     *
     * @return the infix text of the expression
     */
    public abstract String toInfix(Function<String, String> names);

    /**
     * Render this expression as a min/max formula.  A present species is "var(n)", an absent species is
     * "(1-var(n))", AND is nested binary "min" and OR is nested binary "max".
     *
     * @param ids		map of species IDs to variable numbers
     *
     * @return the min/max formula
     */
    public abstract String toMinMax(Map<String, Integer> ids);

    /**
     * @return this expression as a MathML tree
     */
    public abstract ASTNode toMath();

    /**
     * Add the literals in this expression to a list, in order.
     *
     * @param literals	list to which the literals should be added
     */
    protected abstract void collect(List<Literal> literals);

    /**
     * @return the distinct literals in this expression, in order of first appearance
     */
    public List<Literal> getLiterals() {
        List<Literal> all = new ArrayList<Literal>();
        this.collect(all);
        return new ArrayList<Literal>(new LinkedHashSet<Literal>(all));
    }

    /**
     * @return the IDs of the species mentioned in this expression
     */
    public Set<String> getSpeciesIds() {
        Set<String> retVal = new LinkedHashSet<String>();
        for (Literal literal : this.getLiterals())
            retVal.add(literal.getId());
        return retVal;
    }

    @Override
    public String toString() {
        return this.toInfix(x -> x);
    }

    /**
     * This class represents a test of a single species for a required level.
     */
    public static class Literal extends LogicExpression {

        /** ID of the species tested */
        private String id;
        /** required level */
        private int level;

        /**
         * Create a literal.
         *
         * @param id		ID of the species to test
         * @param level		required level (1 for present, 0 for absent)
         */
        public Literal(String id, int level) {
            this.id = id;
            this.level = level;
        }

        /**
         * @return the ID of the species tested
         */
        public String getId() {
            return this.id;
        }

        /**
         * @return the required level
         */
        public int getLevel() {
            return this.level;
        }

        /**
         * @return TRUE if the species must be present
         */
        public boolean isPositive() {
            return this.level > 0;
        }

        @Override
        public String toInfix(Function<String, String> names) {
            String name = names.apply(this.id);
            return (this.isPositive() ? name : "!" + name);
        }

        @Override
        public String toMinMax(Map<String, Integer> ids) {
            String var = "var(" + ids.get(this.id) + ")";
            return (this.isPositive() ? var : "(1-" + var + ")");
        }

        @Override
        public ASTNode toMath() {
            ASTNode retVal = new ASTNode(ASTNode.Type.RELATIONAL_EQ);
            retVal.addChild(new ASTNode(this.id));
            retVal.addChild(new ASTNode(this.level));
            return retVal;
        }

        @Override
        protected void collect(List<Literal> literals) {
            literals.add(this);
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + ((this.id == null) ? 0 : this.id.hashCode());
            result = prime * result + this.level;
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null)
                return false;
            if (getClass() != obj.getClass())
                return false;
            Literal other = (Literal) obj;
            if (this.id == null) {
                if (other.id != null)
                    return false;
            } else if (!this.id.equals(other.id))
                return false;
            if (this.level != other.level)
                return false;
            return true;
        }

    }

    /**
     * This is the base class for an operator applied to a list of sub-expressions.
     */
    protected abstract static class Compound extends LogicExpression {

        /** sub-expressions, in order */
        private List<LogicExpression> parts;

        /**
         * Create a compound expression.
         *
         * @param parts		sub-expressions
         */
        protected Compound(List<? extends LogicExpression> parts) {
            this.parts = new ArrayList<LogicExpression>(parts);
        }

        /**
         * @return the sub-expressions
         */
        public List<LogicExpression> getParts() {
            return Collections.unmodifiableList(this.parts);
        }

        /**
         * @return the infix operator symbol
         */
        protected abstract String getSymbol();

        /**
         * @return the min/max function name
         */
        protected abstract String getFunction();

        /**
         * @return the MathML node type
         */
        protected abstract ASTNode.Type getMathType();

        @Override
        public String toInfix(Function<String, String> names) {
            StringBuilder retVal = new StringBuilder(this.parts.size() * 10);
            retVal.append('(');
            for (int i = 0; i < this.parts.size(); i++) {
                if (i > 0)
                    retVal.append(' ').append(this.getSymbol()).append(' ');
                retVal.append(this.parts.get(i).toInfix(names));
            }
            retVal.append(')');
            return retVal.toString();
        }

        @Override
        public String toMinMax(Map<String, Integer> ids) {
            // Build the nested binary form from the right.
            final int n = this.parts.size();
            String retVal = this.parts.get(n - 1).toMinMax(ids);
            for (int i = n - 2; i >= 0; i--)
                retVal = this.getFunction() + "(" + this.parts.get(i).toMinMax(ids) + "," + retVal + ")";
            return retVal;
        }

        @Override
        public ASTNode toMath() {
            ASTNode retVal = new ASTNode(this.getMathType());
            for (LogicExpression part : this.parts)
                retVal.addChild(part.toMath());
            return retVal;
        }

        @Override
        protected void collect(List<Literal> literals) {
            for (LogicExpression part : this.parts)
                part.collect(literals);
        }

    }

    /**
     * This class represents an expression that is true when all its parts are true.
     */
    public static class And extends Compound {

        public And(List<? extends LogicExpression> parts) {
            super(parts);
        }

        @Override
        protected String getSymbol() {
            return "&";
        }

        @Override
        protected String getFunction() {
            return "min";
        }

        @Override
        protected ASTNode.Type getMathType() {
            return ASTNode.Type.LOGICAL_AND;
        }

    }

    /**
     * This class represents an expression that is true when any of its parts is true.
     */
    public static class Or extends Compound {

        public Or(List<? extends LogicExpression> parts) {
            super(parts);
        }

        @Override
        protected String getSymbol() {
            return "|";
        }

        @Override
        protected String getFunction() {
            return "max";
        }

        @Override
        protected ASTNode.Type getMathType() {
            return ASTNode.Type.LOGICAL_OR;
        }

    }

}
