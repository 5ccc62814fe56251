package com.threatintel.auth.condition;

/**
 * Constant {@code TRUE} or {@code FALSE}. Use {@link CondBuilder#TRUE} and {@link CondBuilder#FALSE}.
 */
public final class FixedCond extends Cond {

    static final FixedCond TRUE = new FixedCond(true);
    static final FixedCond FALSE = new FixedCond(false);

    private final boolean value;

    private FixedCond(boolean value) {
        this.value = value;
    }

    static FixedCond of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R> R accept(CondVisitor<R> visitor) {
        return visitor.visitFixed(this);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof FixedCond that && value == that.value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return value ? "<TRUE>" : "<FALSE>";
    }
}
