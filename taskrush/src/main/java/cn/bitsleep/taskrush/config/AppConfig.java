package cn.bitsleep.taskrush.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;

@Configuration
public class AppConfig {

    private static final int DEFAULT_REDIS_PORT = 6379;

    @Value("${taskrush.redis.url}")
    private String redisUrl;

    /** Source of "now" for createdAt and urgency scoring. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        return Redisson.create(redissonConfig(redisUrl));
    }

    /**
     * Builds a single-server config from {@code redis[s]://[user:]password@host[:port]}.
     * Credentials are split out so Redis ACL users work; {@code rediss} turns on TLS.
     */
    static Config redissonConfig(String redisUrl) {
        URI uri;
        try {
            uri = new URI(redisUrl);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid Redis URL: " + redisUrl, e);
        }
        String scheme = uri.getScheme();
        if ((!"redis".equals(scheme) && !"rediss".equals(scheme)) || uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid Redis URL: " + redisUrl);
        }
        int port = uri.getPort() == -1 ? DEFAULT_REDIS_PORT : uri.getPort();

        Config config = new Config();
        SingleServerConfig single = config.useSingleServer()
                .setAddress(scheme + "://" + uri.getHost() + ":" + port);

        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            if (colon < 0) {
                single.setPassword(userInfo); // password only
            } else {
                if (colon > 0) single.setUsername(userInfo.substring(0, colon));
                single.setPassword(userInfo.substring(colon + 1));
            }
        }
        return config;
    }
}
