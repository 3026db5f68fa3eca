package com.company.pmm.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveRequest {
    @NotBlank(message = "resolved_by is required")
    private String resolvedBy;
}
