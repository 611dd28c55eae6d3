package com.smartstream.transform.config;

import com.smartstream.transform.model.LakeLayout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LakeConfiguration {

    @Value("${app.lake.bucket}")
    private String bucket;

    @Value("${app.lake.raw-prefix:raw/}")
    private String rawPrefix;

    @Value("${app.lake.trusted-prefix:trusted/}")
    private String trustedPrefix;

    @Value("${app.lake.analytics-prefix:analytics/}")
    private String analyticsPrefix;

    @Bean
    public LakeLayout lakeLayout() {
        return new LakeLayout(bucket, rawPrefix, trustedPrefix, analyticsPrefix);
    }
}
