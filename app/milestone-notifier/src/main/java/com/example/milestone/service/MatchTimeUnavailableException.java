package com.example.milestone.service;

/** fixture の開始時刻を解決できず、配信ウィンドウの起点を決められない。 */
public class MatchTimeUnavailableException extends RuntimeException {

  public MatchTimeUnavailableException(long fixtureId) {
    super("fixture start time not found fixtureId=" + fixtureId);
  }

  public MatchTimeUnavailableException(long fixtureId, Throwable cause) {
    super("fixture start time lookup failed fixtureId=" + fixtureId, cause);
  }
}
