package com.infomedia.abacox.pnrquality.component.importing;

/**
 * Identity of a passenger within an import: control number, surname and first name.
 */
public record PassengerKey(String controlNumber, String surname, String firstName) {
}
