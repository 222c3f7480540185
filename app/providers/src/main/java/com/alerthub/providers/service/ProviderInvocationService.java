/*
 * どこで: Providers サービス層
 * 何を: プロバイダの公開メソッドを名前で呼び出し、失敗を分類して返す
 * なぜ: 呼び出し側の入力誤り/プロバイダ報告の失敗/内部障害を境界で区別できるようにするため
 */
package com.alerthub.providers.service;

import com.alerthub.providers.spi.InvalidParametersException;
import com.alerthub.providers.spi.MethodArguments;
import com.alerthub.providers.spi.Provider;
import com.alerthub.providers.spi.ProviderException;
import com.alerthub.providers.spi.ProviderMethod;
import com.alerthub.providers.spi.ProviderType;
import java.util.Map;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProviderInvocationService {

  private static final Logger logger = LoggerFactory.getLogger(ProviderInvocationService.class);

  private final ProviderInstanceResolver instanceResolver;
  private final ProvidersFactory providersFactory;
  private final ProvidersMetrics metrics;

  public Object invoke(
      String tenantId, String providerId, String methodName, Map<String, Object> params) {
    final Map<String, Object> supplied = params == null ? Map.of() : params;
    try (Provider provider = instanceResolver.resolve(tenantId, providerId)) {
      final ProviderType<?> type = providersFactory.getProviderType(provider.providerType());
      final Object result = dispatch(type, provider, methodName, supplied);
      metrics.recordInvoke(methodName, "success");
      return result;
    } catch (ProviderNotFoundException | InvalidParametersException ex) {
      metrics.recordInvoke(methodName, "rejected");
      throw ex;
    } catch (ProviderException ex) {
      metrics.recordInvoke(methodName, "provider_error");
      logger.warn(
          "provider method failed tenant_id={} provider_id={} method={} reason={}",
          tenantId,
          providerId,
          methodName,
          ex.getMessage());
      throw ex;
    } catch (IllegalArgumentException ex) {
      metrics.recordInvoke(methodName, "rejected");
      throw new InvalidParametersException(methodName + "(): " + ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      metrics.recordInvoke(methodName, "internal_error");
      logger.error(
          "provider method raised unexpected error tenant_id={} provider_id={} method={} params={}",
          tenantId,
          providerId,
          methodName,
          new TreeSet<>(supplied.keySet()),
          ex);
      throw new ProviderInternalException(ex);
    }
  }

  private <P extends Provider> Object dispatch(
      ProviderType<P> type, Provider provider, String methodName, Map<String, Object> params) {
    // メソッドの有無は引数より先に判定する。
    final ProviderMethod<P> method =
        type.methods()
            .find(methodName)
            .orElseThrow(() -> ProviderNotFoundException.unknownMethod(type.typeName(), methodName));
    final MethodArguments arguments = method.bind(params);
    logger.debug(
        "invoking provider method provider_type={} provider_id={} method={}",
        type.typeName(),
        provider.providerId(),
        methodName);
    return type.methods().invoke(method, provider, arguments);
  }
}
