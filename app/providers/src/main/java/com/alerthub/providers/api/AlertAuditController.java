/*
 * どこで: Providers API
 * 何を: アラートの監査履歴 (畳み込み済み) を返すエンドポイントを提供する
 * なぜ: 繰り返し操作をまとめた履歴を画面へ直接渡すため
 */
package com.alerthub.providers.api;

import com.alerthub.providers.api.response.AlertAuditResponse;
import com.alerthub.providers.audit.AlertAuditService;
import com.alerthub.providers.config.AuthenticatedEntity;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/alerts")
@RequiredArgsConstructor
public class AlertAuditController {

  private final AlertAuditService auditService;

  @GetMapping("/{fingerprint}/audit")
  @PreAuthorize("hasAuthority('read:alert')")
  public List<AlertAuditResponse> getAlertAudit(
      @AuthenticationPrincipal AuthenticatedEntity entity,
      @PathVariable("fingerprint") String fingerprint) {
    return auditService.getAudit(entity.tenantId(), fingerprint);
  }
}
