package com.remindme.backend.reminder.scheduler;

import com.remindme.backend.reminder.domain.Reminder;

/** Delivers a due reminder to its chat. */
public interface ReminderNotifier {

  /**
   * @throws ReminderDeliveryException when the reminder could not be delivered; it stays pending
   *     and is retried on the next poll
   */
  void deliver(Reminder reminder);

  /**
   * Sends the advance notice of a reminder that is due later.
   *
   * @throws ReminderDeliveryException when the notice could not be delivered
   */
  void deliverPreNotice(Reminder reminder);
}
