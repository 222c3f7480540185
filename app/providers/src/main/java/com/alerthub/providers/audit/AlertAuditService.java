/*
 * どこで: アラート監査履歴
 * 何を: fingerprint 単位の監査イベントを読み出し、畳み込んだ履歴を返す
 * なぜ: 画面表示用の履歴を保存形式から切り離して組み立てるため
 */
package com.alerthub.providers.audit;

import com.alerthub.providers.api.response.AlertAuditResponse;
import com.alerthub.providers.model.AlertAuditEvent;
import com.alerthub.providers.repository.AlertAuditRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AlertAuditService {

  private static final Logger logger = LoggerFactory.getLogger(AlertAuditService.class);

  private final AlertAuditRepository auditRepository;
  private final AlertAuditCompactor compactor;

  public List<AlertAuditResponse> getAudit(String tenantId, String fingerprint) {
    final List<AlertAuditEvent> events = auditRepository.findByFingerprint(tenantId, fingerprint);
    final List<AlertAuditResponse> compacted =
        compactor.compactToList(events).stream().map(AlertAuditResponse::from).toList();
    logger.debug(
        "alert audit loaded tenant_id={} fingerprint={} events={} compacted={}",
        tenantId,
        fingerprint,
        events.size(),
        compacted.size());
    return compacted;
  }
}
