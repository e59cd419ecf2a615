package org.nowstart.stratagem.pipeline;

/**
 * Answer to the interpretation check. A rejection may carry a corrected strategy description.
 */
public record HumanConfirmation(boolean confirmed, String editedInput) {

    public static HumanConfirmation confirm() {
        return new HumanConfirmation(true, null);
    }

    public static HumanConfirmation reject(String editedInput) {
        return new HumanConfirmation(false, editedInput);
    }

    public boolean hasEdits() {
        return editedInput != null && !editedInput.isBlank();
    }
}
