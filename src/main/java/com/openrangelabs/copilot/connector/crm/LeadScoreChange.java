package com.openrangelabs.copilot.connector.crm;

/**
 * Outcome of a successful lead-score update.
 *
 * @param recordId      CRM id of the updated record
 * @param previousScore score field value before the update, null when the record had none
 * @param newScore      score that was written
 */
public record LeadScoreChange(String recordId, Object previousScore, int newScore) {
}
