package com.infomedia.abacox.pnrquality.dto.pnr;

import com.infomedia.abacox.pnrquality.dto.superclass.AuditedDto;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * DTO for {@link com.infomedia.abacox.pnrquality.db.entity.Pnr}
 */
@EqualsAndHashCode(callSuper = true)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PnrDto extends AuditedDto {
    private Long id;
    private String controlNumber;
    private String officeId;
    private String agent;
    private String deliverySystemCompany;
    private String deliverySystemLocation;
    private LocalDate creationDate;
}
