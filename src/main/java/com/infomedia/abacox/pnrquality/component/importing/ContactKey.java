package com.infomedia.abacox.pnrquality.component.importing;

public record ContactKey(String controlNumber, String contactType, String contactDetail) {
}
