package io.github.drompincen.dispatchguard.protocol.api;

public final class LegalReferences {

    public static final String DISPATCH_ACT_ART_26 = "労働者派遣法第26条";
    public static final String DISPATCH_ACT_ART_40_2 = "労働者派遣法第40条の2";
    public static final String LABOR_STANDARDS_ACT_ART_36 = "労働基準法第36条";
    public static final String IMMIGRATION_CONTROL_ACT = "入管法";

    private LegalReferences() {}
}
