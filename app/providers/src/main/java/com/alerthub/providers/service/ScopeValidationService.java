/*
 * どこで: Providers サービス層
 * 何を: プロバイダに権限の自己診断をさせ、必須 scope の判定と結果の保存を行う
 * なぜ: 権限不足のままインストールさせず、変化があった時だけレコードを更新するため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.model.ProviderRecord;
import com.alerthub.providers.repository.ProviderRepository;
import com.alerthub.providers.spi.Provider;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScopeValidationService {

  private static final Logger logger = LoggerFactory.getLogger(ScopeValidationService.class);

  private final ProviderRepository providerRepository;
  private final ProviderInstanceResolver instanceResolver;
  private final ProvidersFactory providersFactory;
  private final ProviderExecutionLogService executionLogService;
  private final ProvidersMetrics metrics;

  public Map<String, Object> validateScopes(
      Provider provider, ProviderTypeDescriptor descriptor, boolean validateMandatory) {
    final Map<String, Object> reported = provider.validateScopes();
    final Map<String, Object> validatedScopes =
        reported == null ? new LinkedHashMap<>() : new LinkedHashMap<>(reported);
    if (validateMandatory && !validatedScopes.isEmpty()) {
      final List<String> failed =
          descriptor.mandatoryScopeNames().stream()
              .filter(scope -> !Boolean.TRUE.equals(validatedScopes.get(scope)))
              .toList();
      if (!failed.isEmpty()) {
        metrics.recordScopeValidation("precondition_failed");
        logger.info(
            "mandatory scopes not granted provider_type={} provider_id={} scopes={}",
            provider.providerType(),
            provider.providerId(),
            failed);
        throw new ScopeValidationFailedException(validatedScopes, failed);
      }
    }
    metrics.recordScopeValidation("validated");
    return validatedScopes;
  }

  public Map<String, Object> revalidate(String tenantId, String providerId) {
    final ProviderRecord record =
        providerRepository
            .findByTenantAndId(tenantId, providerId)
            .orElseThrow(() -> ProviderNotFoundException.unknownProvider(providerId));
    final ProviderTypeDescriptor descriptor = providersFactory.getProviderClass(record.type());
    final Map<String, Object> validatedScopes;
    try (Provider provider = instanceResolver.resolveRecord(record)) {
      validatedScopes = validateScopes(provider, descriptor, false);
    }
    if (validatedScopes.equals(record.validatedScopes())) {
      logger.debug("validated scopes unchanged tenant_id={} provider_id={}", tenantId, providerId);
      return validatedScopes;
    }
    providerRepository.updateValidatedScopes(tenantId, providerId, validatedScopes);
    executionLogService.info(
        tenantId, providerId, "validated scopes changed", Map.of("validated_scopes", validatedScopes));
    logger.info(
        "validated scopes updated tenant_id={} provider_id={} scopes={}",
        tenantId,
        providerId,
        validatedScopes);
    return validatedScopes;
  }
}
