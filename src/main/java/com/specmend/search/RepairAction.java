package com.specmend.search;

import java.util.Objects;

/** One candidate step: an action type plus its target (issue text or area). */
public final class RepairAction {

    private final ActionType type;
    private final String     target;

    public RepairAction(ActionType type, String target) {
        this.type   = Objects.requireNonNull(type, "type");
        this.target = Objects.requireNonNull(target, "target");
    }

    public static RepairAction fix(String issue)      { return new RepairAction(ActionType.FIX, issue); }
    public static RepairAction enhance(String area)   { return new RepairAction(ActionType.ENHANCE, area); }
    public static RepairAction validate(String scope) { return new RepairAction(ActionType.VALIDATE, scope); }

    public ActionType getType() { return type; }

    public String getTarget() { return target; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RepairAction)) return false;
        RepairAction other = (RepairAction) o;
        return type == other.type && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, target);
    }

    @Override
    public String toString() {
        return type + "(" + target + ")";
    }
}
