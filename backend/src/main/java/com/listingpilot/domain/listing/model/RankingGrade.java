package com.listingpilot.domain.listing.model;

/**
 * Letter grade of a ranking score, each with a fixed verdict.
 */
public enum RankingGrade {
    A_PLUS("A+", 90, "EXCELLENT - Top 5% listing quality"),
    A("A", 80, "GREAT - Strong ranking potential"),
    B("B", 70, "GOOD - Above average, room for improvement"),
    C("C", 60, "AVERAGE - Needs optimization"),
    D("D", Double.NEGATIVE_INFINITY, "NEEDS WORK - Significant improvements required");

    private final String label;
    private final double floor;
    private final String verdict;

    RankingGrade(String label, double floor, String verdict) {
        this.label = label;
        this.floor = floor;
        this.verdict = verdict;
    }

    public String label() {
        return label;
    }

    public String verdict() {
        return verdict;
    }

    public static RankingGrade of(double score) {
        for (RankingGrade grade : values()) {
            if (score >= grade.floor) {
                return grade;
            }
        }
        return D;
    }
}
