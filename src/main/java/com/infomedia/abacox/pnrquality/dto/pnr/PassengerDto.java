package com.infomedia.abacox.pnrquality.dto.pnr;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for {@link com.infomedia.abacox.pnrquality.db.entity.Passenger}
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PassengerDto {
    private String surname;
    private String firstName;
    private String ffNumber;
    private String meal;
    private String seatRowNumber;
    private String seatColumn;
    private String seat;
}
