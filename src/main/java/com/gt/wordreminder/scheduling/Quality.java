package com.gt.wordreminder.scheduling;

// Answer grades on the SM-2 0..5 scale. The bot only produces the two binary grades.
public final class Quality {

    public static final int MIN = 0;
    public static final int MAX = 5;
    public static final int PASSING = 3;

    public static final int INCORRECT = MIN;
    public static final int CORRECT = MAX;

    private Quality() { }

    public static boolean isValid(int quality) {
        return quality >= MIN && quality <= MAX;
    }

    public static boolean isCorrect(int quality) {
        return quality >= PASSING;
    }
}
