/*
 * どこで: 組み込みプロバイダ (console)
 * 何を: 認証不要で通知をアプリケーションログへ出力する種別を登録する
 * なぜ: default-console として設定無しで通知経路を試せるようにするため
 */
package com.alerthub.providers.integration.console;

import com.alerthub.providers.spi.MethodParameter;
import com.alerthub.providers.spi.ParameterType;
import com.alerthub.providers.spi.ProviderCapability;
import com.alerthub.providers.spi.ProviderConfig;
import com.alerthub.providers.spi.ProviderContext;
import com.alerthub.providers.spi.ProviderMethodRegistry;
import com.alerthub.providers.spi.ProviderType;
import com.alerthub.providers.spi.ProviderTypeDescriptor;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ConsoleProviderType extends ProviderType<ConsoleProvider> {

  public static final String TYPE = "console";

  public ConsoleProviderType() {
    super(typeDescriptor(), methodRegistry());
  }

  @Override
  public ConsoleProvider create(ProviderContext context, String providerId, ProviderConfig config) {
    return new ConsoleProvider(context, providerId, TYPE, config);
  }

  private static ProviderTypeDescriptor typeDescriptor() {
    return new ProviderTypeDescriptor(
        TYPE,
        "Console",
        List.of(),
        List.of(),
        EnumSet.of(ProviderCapability.NOTIFY, ProviderCapability.HEALTH),
        List.of("messaging"),
        List.of("Developer Tools"),
        Map.of(),
        null,
        false);
  }

  private static ProviderMethodRegistry<ConsoleProvider> methodRegistry() {
    return ProviderMethodRegistry.builder(ConsoleProvider.class)
        .method(
            "notify",
            "Write a message to the service log",
            List.of(
                MethodParameter.required("message", ParameterType.STRING),
                MethodParameter.optional("severity", ParameterType.STRING)),
            (provider, args) ->
                provider.notify(args.string("message"), args.string("severity", "info")))
        .build();
  }
}
