package com.example.tactics.status;

public enum StabilizationMethod {
    /** Cantrip; always works. */
    SPARE_THE_DYING("Spare the Dying", true),
    /** One use of a healer's kit; always works. */
    HEALERS_KIT("Healer's Kit", true),
    /** DC 10 Wisdom (Medicine) check. */
    MEDICINE("Medicine", false);

    private final String displayName;
    private final boolean automatic;

    StabilizationMethod(String displayName, boolean automatic) {
        this.displayName = displayName;
        this.automatic = automatic;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isAutomatic() {
        return automatic;
    }
}
