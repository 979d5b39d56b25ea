package com.whereq.dispatch.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to change a job's time-to-live
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TtlRequest {
    /**
     * New inactivity TTL in seconds
     */
    @NotNull
    @Min(0)
    private Long ttl;
}
