package com.smartbin.domain.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Total, media y ocurrencias de un grupo de lecturas (hora, día de semana).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BucketStats {

    private double total;
    private double mean;
    private int count;
}
