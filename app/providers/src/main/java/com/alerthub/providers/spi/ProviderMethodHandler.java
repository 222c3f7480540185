package com.alerthub.providers.spi;

@FunctionalInterface
public interface ProviderMethodHandler<P extends Provider> {

  Object handle(P provider, MethodArguments arguments);
}
