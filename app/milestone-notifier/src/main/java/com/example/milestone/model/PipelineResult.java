package com.example.milestone.model;

/** fixture 1 件分のパイプライン実行結果。 */
public record PipelineResult(long fixtureId, int changeCount, int scheduledCount) {

  public static PipelineResult noChanges(long fixtureId) {
    return new PipelineResult(fixtureId, 0, 0);
  }
}
