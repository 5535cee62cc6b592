package com.infomedia.abacox.pnrquality.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PnrScoreDto {
    private String controlNumber;
    private String officeId;
    private String deliverySystemCompany;
    private LocalDate creationDate;
    private int contactCount;
    private int score;
}
