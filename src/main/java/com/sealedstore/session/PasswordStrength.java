package com.sealedstore.session;

import java.util.ArrayList;
import java.util.List;

/**
 * Score 0..5, one point per requirement met, with a hint for every requirement missed.
 */
public record PasswordStrength(int score, List<String> feedback) {

    public static final int MAX_SCORE = 5;
    public static final int MIN_LENGTH = 12;

    private static final String SPECIAL_CHARS = "!@#$%^&*(),.?\":{}|<>";

    public PasswordStrength {
        feedback = List.copyOf(feedback);
    }

    public static PasswordStrength evaluate(char[] password) {
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean special = false;
        for (char c : password) {
            if (c >= 'A' && c <= 'Z') upper = true;
            else if (c >= 'a' && c <= 'z') lower = true;
            else if (c >= '0' && c <= '9') digit = true;
            else if (SPECIAL_CHARS.indexOf(c) >= 0) special = true;
        }

        int score = 0;
        List<String> feedback = new ArrayList<>();
        score += check(password.length >= MIN_LENGTH, "Use at least " + MIN_LENGTH + " characters", feedback);
        score += check(upper, "Add uppercase letters", feedback);
        score += check(lower, "Add lowercase letters", feedback);
        score += check(digit, "Add numbers", feedback);
        score += check(special, "Add special characters", feedback);
        return new PasswordStrength(score, feedback);
    }

    public boolean meets(int minimumScore) {
        return score >= minimumScore;
    }

    private static int check(boolean met, String hint, List<String> feedback) {
        if (!met) {
            feedback.add(hint);
        }
        return met ? 1 : 0;
    }
}
