package com.infomedia.abacox.pnrquality.dto.pnr;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactQualityDto {
    private String contactType;
    private String contactDetail;
    private String normalizedDetail;
    private boolean email;
    private boolean phone;
    private boolean validEmail;
    private boolean validPhone;
    private boolean wronglyPlaced;
    private boolean wrongFormat;
}
