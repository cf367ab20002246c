/*
 * どこで: Milestone サービス層
 * 何を: fixture のパーセンタイル差分から注目に値するものだけを残す
 * なぜ: 節目の通過と大きな変動だけがプッシュに値するため
 */
package com.example.milestone.service;

import com.example.milestone.config.ChangeDetectionProperties;
import com.example.milestone.model.Change;
import com.example.milestone.repository.PercentileChangeRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ChangeDetector {

  private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

  private final PercentileChangeRepository percentileChangeRepository;
  private final ChangeDetectionProperties properties;

  /**
   * fixture の有意な変化を返す。空リストは正常な結果。前回のパーセンタイルが無い行は比較対象が
   * 無いため除外する。
   *
   * @throws ChangeDetectionException 差分の取得に失敗したとき
   */
  public List<Change> detect(long fixtureId) {
    final List<Change> rows;
    try {
      rows = percentileChangeRepository.findByFixtureId(fixtureId);
    } catch (DataAccessException ex) {
      throw new ChangeDetectionException(fixtureId, ex);
    }
    final List<Change> withBaseline = rows.stream().filter(Change::hasBaseline).toList();
    if (withBaseline.size() < rows.size()) {
      logger.debug(
          "skipping changes without baseline fixtureId={} skipped={}",
          fixtureId,
          rows.size() - withBaseline.size());
    }
    return withBaseline.stream().filter(this::isSignificant).toList();
  }

  public boolean isSignificant(Change change) {
    if (!change.hasBaseline()) {
      return false;
    }
    return isSignificant(change.oldPercentile(), change.newPercentile());
  }

  /**
   * いずれかの節目をどちらかの向きに通過したとき({@code old < m <= new} または
   * {@code old >= m > new})、または差分の絶対値がしきい値に達したときに true。
   */
  public boolean isSignificant(double oldPercentile, double newPercentile) {
    for (double milestone : properties.milestones()) {
      final boolean crossedUp = oldPercentile < milestone && newPercentile >= milestone;
      final boolean crossedDown = oldPercentile >= milestone && newPercentile < milestone;
      if (crossedUp || crossedDown) {
        return true;
      }
    }
    return Math.abs(newPercentile - oldPercentile) >= properties.deltaThreshold();
  }
}
