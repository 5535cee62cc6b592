package com.infomedia.abacox.pnrquality.dto.superclass;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Data
@SuperBuilder
public class AuditedDto {
    LocalDateTime createdDate;
    LocalDateTime lastModifiedDate;
}
