package com.alerthub.providers.spi;

/** インスタンス生成時に渡す呼び出し文脈。default-* や healthcheck では tenant を持たない。 */
public record ProviderContext(String tenantId, String workflowId) {

  public static ProviderContext forTenant(String tenantId) {
    return new ProviderContext(tenantId, null);
  }

  public static ProviderContext anonymous() {
    return new ProviderContext(null, null);
  }
}
