package com.remindme.backend.command.service;

import com.remindme.backend.command.api.AssistantCommandPayload;
import com.remindme.backend.command.api.CreateRemindersPayload;
import com.remindme.backend.command.api.DeleteRemindersPayload;
import com.remindme.backend.command.api.FilterPayload;
import com.remindme.backend.command.api.ListRemindersPayload;
import com.remindme.backend.command.api.RecurrencePayload;
import com.remindme.backend.command.api.ReminderDraftPayload;
import com.remindme.backend.command.model.CreateCommand;
import com.remindme.backend.command.model.DayReference;
import com.remindme.backend.command.model.DaySpec;
import com.remindme.backend.command.model.DeleteCommand;
import com.remindme.backend.command.model.DeleteMode;
import com.remindme.backend.command.model.FilterMode;
import com.remindme.backend.command.model.ListCommand;
import com.remindme.backend.command.model.ReminderCommand;
import com.remindme.backend.command.model.ReminderFilter;
import com.remindme.backend.command.model.ReminderSpec;
import com.remindme.backend.reminder.domain.RecurrenceRule;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.DayOfWeek;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns an untrusted command payload into a {@link ReminderCommand}. Runs the bean constraints
 * declared on the payload records first, then the cross-field rules; every failure is reported
 * with the wire name of the offending field. Performs no I/O.
 */
@Component
public class CommandValidator {

  private static final Pattern CONTAINER_ELEMENT = Pattern.compile("\\.<[^>]+>");
  private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");

  private final Validator validator;

  public CommandValidator(Validator validator) {
    this.validator = validator;
  }

  public ReminderCommand validate(AssistantCommandPayload payload) {
    if (payload == null) {
      throw new CommandValidationException("command", "NotNull", "команда не распознана");
    }
    List<FieldViolation> violations = new ArrayList<>(constraintViolations(payload));
    if (!violations.isEmpty()) {
      throw new CommandValidationException(violations);
    }

    ReminderCommand command;
    if (payload instanceof CreateRemindersPayload create) {
      command = toCreate(create, violations);
    } else if (payload instanceof ListRemindersPayload list) {
      command = toList(list, violations);
    } else if (payload instanceof DeleteRemindersPayload delete) {
      command = toDelete(delete, violations);
    } else {
      throw new IllegalStateException("Unsupported command payload " + payload.getClass());
    }
    if (!violations.isEmpty()) {
      throw new CommandValidationException(violations);
    }
    return command;
  }

  private CreateCommand toCreate(CreateRemindersPayload payload, List<FieldViolation> violations) {
    List<ReminderSpec> specs = new ArrayList<>();
    List<ReminderDraftPayload> drafts = payload.reminders();
    for (int i = 0; i < drafts.size(); i++) {
      String prefix = "reminders[" + i + "]";
      ReminderSpec spec = toSpec(prefix, drafts.get(i), violations);
      if (spec != null) {
        specs.add(spec);
      }
    }
    return violations.isEmpty() ? new CreateCommand(specs) : null;
  }

  private ReminderSpec toSpec(
      String prefix, ReminderDraftPayload draft, List<FieldViolation> violations) {
    int before = violations.size();
    DayReference day = draft.day();
    if (day == DayReference.WEEKDAY && draft.weekday() == null) {
      violations.add(
          new FieldViolation(prefix + ".weekday", "RequiredForDay", "укажите день недели (0-6)"));
    }
    if (day != DayReference.WEEKDAY && draft.weekday() != null) {
      violations.add(
          new FieldViolation(
              prefix + ".weekday", "OnlyWithWeekday", "день недели допустим только для day=weekday"));
    }
    if (day == DayReference.SPECIFIC_DATE && draft.date() == null) {
      violations.add(new FieldViolation(prefix + ".date", "RequiredForDay", "укажите дату"));
    }
    if (day != DayReference.SPECIFIC_DATE && draft.date() != null) {
      violations.add(
          new FieldViolation(
              prefix + ".date", "OnlyWithSpecificDate", "дата допустима только для day=specific_date"));
    }
    RecurrenceRule rule = toRule(prefix + ".recurrence", draft.recurrence(), violations);
    if (violations.size() > before) {
      return null;
    }

    DaySpec daySpec =
        switch (day) {
          case TODAY -> DaySpec.today();
          case TOMORROW -> DaySpec.tomorrow();
          case DAY_AFTER_TOMORROW -> DaySpec.dayAfterTomorrow();
          case WEEKDAY -> DaySpec.next(DayOfWeek.of(draft.weekday() + 1));
          case SPECIFIC_DATE -> DaySpec.on(draft.date());
        };
    return new ReminderSpec(draft.title().trim(), daySpec, draft.time(), rule);
  }

  private RecurrenceRule toRule(
      String prefix, RecurrencePayload recurrence, List<FieldViolation> violations) {
    if (recurrence == null) {
      return null;
    }
    if (recurrence.maxOccurrences() != null && recurrence.endsAt() != null) {
      violations.add(
          new FieldViolation(
              prefix + ".ends_at",
              "SingleEndCondition",
              "укажите либо количество повторов, либо дату окончания"));
      return null;
    }
    int interval = recurrence.interval() != null ? recurrence.interval() : 1;
    Instant endsAt = recurrence.endsAt() != null ? recurrence.endsAt().toInstant() : null;
    return new RecurrenceRule(recurrence.frequency(), interval, recurrence.maxOccurrences(), endsAt);
  }

  private ListCommand toList(ListRemindersPayload payload, List<FieldViolation> violations) {
    ReminderFilter filter = toFilter("filter", payload.filter(), violations);
    return filter != null ? new ListCommand(filter) : null;
  }

  private DeleteCommand toDelete(DeleteRemindersPayload payload, List<FieldViolation> violations) {
    DeleteMode mode = payload.mode() != null ? payload.mode() : DeleteMode.BY_FILTER;
    if (mode == DeleteMode.LAST_N && payload.lastN() == null) {
      violations.add(
          new FieldViolation("last_n", "RequiredForLastN", "укажите, сколько напоминаний удалить"));
    }
    if (mode == DeleteMode.BY_FILTER && payload.lastN() != null) {
      violations.add(
          new FieldViolation("last_n", "OnlyWithLastN", "last_n допустим только для mode=last_n"));
    }
    ReminderFilter filter = toFilter("filter", payload.filter(), violations);
    if (filter != null
        && mode == DeleteMode.BY_FILTER
        && filter.mode() == FilterMode.ALL
        && !Boolean.TRUE.equals(payload.confirmAll())) {
      violations.add(
          new FieldViolation(
              "confirm_all",
              "ConfirmationRequired",
              "удаление всех напоминаний требует явного подтверждения"));
    }
    if (!violations.isEmpty()) {
      return null;
    }
    return new DeleteCommand(filter, mode, payload.lastN());
  }

  private ReminderFilter toFilter(
      String prefix, FilterPayload payload, List<FieldViolation> violations) {
    if (payload == null) {
      return ReminderFilter.all();
    }
    FilterMode mode = payload.mode() != null ? payload.mode() : FilterMode.ALL;
    int before = violations.size();

    requireFor(mode, FilterMode.STATUS, prefix + ".status", payload.status() != null, violations);
    requireFor(
        mode, FilterMode.SEARCH, prefix + ".search", StringUtils.hasText(payload.search()), violations);
    requireFor(mode, FilterMode.INTERVAL, prefix + ".from", payload.from() != null, violations);
    requireFor(mode, FilterMode.INTERVAL, prefix + ".to", payload.to() != null, violations);
    requireFor(mode, FilterMode.ID, prefix + ".reminder_id", payload.reminderId() != null, violations);
    if (mode == FilterMode.INTERVAL
        && payload.from() != null
        && payload.to() != null
        && !payload.from().toInstant().isBefore(payload.to().toInstant())) {
      violations.add(
          new FieldViolation(prefix + ".to", "AfterFrom", "конец интервала должен быть позже начала"));
    }
    if (violations.size() > before) {
      return null;
    }

    return switch (mode) {
      case ALL -> ReminderFilter.all();
      case TODAY -> ReminderFilter.today();
      case STATUS -> ReminderFilter.withStatus(payload.status());
      case SEARCH -> ReminderFilter.search(payload.search().trim());
      case INTERVAL -> ReminderFilter.interval(
          payload.from().toInstant(), payload.to().toInstant());
      case ID -> ReminderFilter.byId(payload.reminderId());
    };
  }

  private void requireFor(
      FilterMode actual,
      FilterMode owner,
      String field,
      boolean present,
      List<FieldViolation> violations) {
    if (actual == owner && !present) {
      violations.add(
          new FieldViolation(field, "RequiredForMode", "обязательно для mode=" + owner.value()));
    } else if (actual != owner && present) {
      violations.add(
          new FieldViolation(field, "NotAllowedForMode", "недопустимо для mode=" + actual.value()));
    }
  }

  private List<FieldViolation> constraintViolations(AssistantCommandPayload payload) {
    Set<ConstraintViolation<AssistantCommandPayload>> found = validator.validate(payload);
    return found.stream()
        .map(
            violation ->
                new FieldViolation(
                    wirePath(violation.getPropertyPath().toString()),
                    violation.getConstraintDescriptor().getAnnotation().annotationType().getSimpleName(),
                    violation.getMessage()))
        .sorted(Comparator.comparing(FieldViolation::field).thenComparing(FieldViolation::rule))
        .toList();
  }

  static String wirePath(String propertyPath) {
    String withoutContainers = CONTAINER_ELEMENT.matcher(propertyPath).replaceAll("");
    Matcher matcher = CAMEL_BOUNDARY.matcher(withoutContainers);
    return matcher.replaceAll("$1_$2").toLowerCase();
  }
}
