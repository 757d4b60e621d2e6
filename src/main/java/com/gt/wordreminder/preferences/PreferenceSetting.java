package com.gt.wordreminder.preferences;

public enum PreferenceSetting {
    RemindersPerDay("rpd", 1, 24),
    CardsPerSession("cps", 1, 50);

    private final String code;
    private final int minValue;
    private final int maxValue;

    PreferenceSetting(String code, int minValue, int maxValue) {
        this.code = code;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    public String getCode() {
        return code;
    }

    public int getMinValue() {
        return minValue;
    }

    public int getMaxValue() {
        return maxValue;
    }

    public boolean isInRange(int value) {
        return value >= minValue && value <= maxValue;
    }

    public static PreferenceSetting fromCode(String code) {
        for (PreferenceSetting setting : values()) {
            if (setting.code.equals(code)) {
                return setting;
            }
        }

        return null;
    }
}
