package com.tazifor.routeplanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One recurring service a customer subscribes to (e.g. an electrical
 * inspection every 36 months). Either {@code nextDue} is known, or it is
 * derived from {@code lastDone + intervalMonths}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceSchedule {

    public static final int DEFAULT_INTERVAL_MONTHS = 12;

    private String serviceType;
    private LocalDate nextDue;
    private LocalDate lastDone;
    private Integer intervalMonths;  // null → DEFAULT_INTERVAL_MONTHS
}
