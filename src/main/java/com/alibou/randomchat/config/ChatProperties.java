package com.alibou.randomchat.config;

import com.alibou.randomchat.bootstrap.OrphanedSenderPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Getter @Setter
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    private final Stomp stomp = new Stomp();
    private final Bootstrap bootstrap = new Bootstrap();
    private final Pairing pairing = new Pairing();

    @Getter @Setter
    public static class Stomp {
        private String endpoint = "/ws";
        private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
    }

    @Getter @Setter
    public static class Bootstrap {
        /** восстановить кэш из хранилища после старта приложения */
        private boolean enabled = true;
        private OrphanedSenderPolicy orphanedSender = OrphanedSenderPolicy.SKIP;
    }

    @Getter @Setter
    public static class Pairing {
        /** подбирать пару сразу, как только кто-то встал в очередь */
        private boolean autoPair = true;
    }
}
