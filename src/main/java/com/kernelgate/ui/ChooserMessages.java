package com.kernelgate.ui;

/**
 * Status messages shown alongside a chooser's items. Null fields are cleared.
 */
public record ChooserMessages(String info, String loading, String empty, String error) {

    public static final ChooserMessages NONE = new ChooserMessages(null, null, null, null);

    public static ChooserMessages info(String info, String empty) {
        return new ChooserMessages(info, null, empty, null);
    }

    public static ChooserMessages loading(String loading, String empty) {
        return new ChooserMessages(null, loading, empty, null);
    }
}
