package com.homesplit.engine;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Materializes recurring templates into the dated occurrences falling inside one month.
 *
 * <p>Monthly templates produce at most one occurrence per month whose id is
 * {@code templateId_yyyy_MM}. Daily and weekly templates can produce several, so their ids carry
 * the day of month as an extra {@code _dd} suffix. Expanding the same month twice always yields the
 * same ids.
 */
public class RecurrenceExpander {

  public List<ExpenseInstance> expand(Collection<RecurringTemplate> templates, YearMonth month) {
    List<ExpenseInstance> instances = new ArrayList<>();
    for (RecurringTemplate template : templates) {
      instances.addAll(expand(template, month));
    }
    return instances;
  }

  public List<ExpenseInstance> expand(RecurringTemplate template, YearMonth month) {
    LocalDate first = month.atDay(1);
    LocalDate last = month.atEndOfMonth();
    if (template.startDate().isAfter(last)) {
      return List.of();
    }
    if (template.endDate() != null && template.endDate().isBefore(first)) {
      return List.of();
    }
    Frequency frequency = template.frequency();
    List<ExpenseInstance> instances = new ArrayList<>();
    long index = frequency.indexNotAfter(template.startDate(), first);
    LocalDate date = frequency.occurrence(template.startDate(), index);
    while (!date.isAfter(last)) {
      if (template.endDate() != null && date.isAfter(template.endDate())) {
        break;
      }
      if (YearMonth.from(date).equals(month)) {
        instances.add(toInstance(template, month, date));
      }
      index++;
      date = frequency.occurrence(template.startDate(), index);
    }
    return instances;
  }

  public static String instanceId(RecurringTemplate template, YearMonth month, LocalDate date) {
    String base = String.format("%s_%04d_%02d", template.id(), month.getYear(), month.getMonthValue());
    return switch (template.frequency()) {
      case MONTHLY -> base;
      case DAILY, WEEKLY -> String.format("%s_%02d", base, date.getDayOfMonth());
    };
  }

  private ExpenseInstance toInstance(RecurringTemplate template, YearMonth month, LocalDate date) {
    return new ExpenseInstance(
        instanceId(template, month, date),
        template.id(),
        template.groupId(),
        template.amount(),
        template.category(),
        template.description(),
        template.payer(),
        date);
  }
}
