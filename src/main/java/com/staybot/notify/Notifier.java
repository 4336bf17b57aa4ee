package com.staybot.notify;

import com.staybot.model.Candidate;
import com.staybot.model.PriceDropReport;
import com.staybot.model.SearchCriteria;
import com.staybot.model.TrackedItem;

import java.util.List;

/**
 * Outbound notification channel. Each call returns whether the message was delivered;
 * an empty batch is a successful no-op.
 */
public interface Notifier {

    boolean notifyNewItems(List<TrackedItem> items, SearchCriteria criteria) throws NotifyException;

    boolean notifyPriceDrops(List<PriceDropReport> drops) throws NotifyException;

    boolean notifyBelowTarget(List<Candidate> candidates, double targetPrice, String currency) throws NotifyException;

    boolean sendTest() throws NotifyException;
}
