package com.smartstream.transform;

import com.smartstream.transform.model.RouteTable;
import com.smartstream.transform.service.SqsRawObjectListener;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "aws.region=us-east-1",
        "app.sqs.listener.enabled=false"
})
class TransformApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(context.getBean(RouteTable.class).lookup("finance", "transactions")).isPresent();
        assertThat(context.getBeansOfType(SqsRawObjectListener.class)).isEmpty();
    }
}
