package com.conveyal.wtt.filter;

public enum AcFilter {
    ALL,
    AC,
    NON_AC;

    public boolean accepts (boolean ac) {
        switch (this) {
            case AC: return ac;
            case NON_AC: return !ac;
            default: return true;
        }
    }
}
