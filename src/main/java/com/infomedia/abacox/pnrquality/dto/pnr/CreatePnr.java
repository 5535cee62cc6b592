package com.infomedia.abacox.pnrquality.dto.pnr;

import com.infomedia.abacox.pnrquality.db.entity.Pnr;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CreatePnr {
    @NotBlank
    @Size(max = Pnr.CONTROL_NUMBER_LENGTH)
    private String controlNumber;

    @Size(max = Pnr.OFFICE_ID_LENGTH)
    private String officeId;

    @Size(max = Pnr.AGENT_LENGTH)
    private String agent;

    @Size(max = Pnr.DELIVERY_SYSTEM_COMPANY_LENGTH)
    private String deliverySystemCompany;

    @Size(max = Pnr.DELIVERY_SYSTEM_LOCATION_LENGTH)
    private String deliverySystemLocation;

    private LocalDate creationDate;
}
