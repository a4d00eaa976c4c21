package com.semver.report;

import com.semver.version.Precedence;
import com.semver.version.Version;

public record ComparisonReport(String left, String right, String relation, boolean before, boolean equal) {

    public static ComparisonReport of(Version left, Version right) {
        int comparison = Precedence.compare(left, right);
        String relation = comparison < 0 ? "<" : comparison > 0 ? ">" : "==";
        return new ComparisonReport(left.toString(), right.toString(), relation, left.before(right), left.equals(right));
    }

    public String describe() {
        return left + " " + relation + " " + right;
    }
}
