package com.tazifor.routeplanner.service;

import com.tazifor.routeplanner.model.CustomerLocation;
import com.tazifor.routeplanner.model.ServiceSchedule;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Works out when a customer next needs a visit.
 *
 * RESOLUTION ORDER:
 * 1. Service schedules: for each, {@code nextDue}, or {@code lastDone + intervalMonths}
 *    when only the last visit is known. The earliest date across schedules wins.
 * 2. The customer's own {@code nextDueDate}.
 * 3. Nothing: the customer cannot be planned and is not eligible.
 */
@Component
public class DueDateResolver {

    public Optional<LocalDate> resolve(CustomerLocation customer) {
        if (customer == null) {
            return Optional.empty();
        }

        LocalDate earliest = null;
        if (customer.getServices() != null) {
            for (ServiceSchedule service : customer.getServices()) {
                LocalDate next = dueDateOf(service);
                if (next != null && (earliest == null || next.isBefore(earliest))) {
                    earliest = next;
                }
            }
        }
        if (earliest != null) {
            return Optional.of(earliest);
        }
        return Optional.ofNullable(customer.getNextDueDate());
    }

    private LocalDate dueDateOf(ServiceSchedule service) {
        if (service == null) {
            return null;
        }
        if (service.getNextDue() != null) {
            return service.getNextDue();
        }
        if (service.getLastDone() != null) {
            int months = service.getIntervalMonths() != null
                ? service.getIntervalMonths()
                : ServiceSchedule.DEFAULT_INTERVAL_MONTHS;
            return service.getLastDone().plusMonths(months);
        }
        return null;
    }
}
