package com.example.tactics.status;

/**
 * An already-rolled Wisdom (Medicine) check.
 *
 * @param success whether the total met DC 10
 * @param roll the kept d20 face
 * @param total roll plus modifiers
 */
public record MedicineCheck(boolean success, int roll, int total) {

    public static MedicineCheck of(int roll, int total) {
        return new MedicineCheck(total >= DeathSaves.DC, roll, total);
    }
}
