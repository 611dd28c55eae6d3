package com.smartstream.transform.service;

import com.smartstream.transform.dto.TransformStatus;
import com.smartstream.transform.model.S3ObjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;

import java.util.List;
import java.util.Map;

/**
 * Polls the queue that receives the data-lake bucket's "object created" notifications.
 *
 * <p>Messages of one batch are handled in turn; each one's visibility is renewed when its turn
 * comes, so the timeout covers a single message rather than the whole batch.
 *
 * <p>A message is deleted once every object it names was transformed (or skipped). If any object
 * failed, the message stays on the queue with a growing visibility timeout so SQS redelivers it.
 * Messages that are not notifications at all are deleted after being logged.
 */
@Service
@ConditionalOnProperty(name = "app.sqs.listener.enabled", havingValue = "true", matchIfMissing = true)
public class SqsRawObjectListener {

    private static final Logger logger = LoggerFactory.getLogger(SqsRawObjectListener.class);

    private static final int[] REDELIVERY_DELAYS_SECONDS = {30, 60, 120, 240, 300};

    private final SqsClient sqsClient;
    private final S3EventNotificationParser notificationParser;
    private final RawToTrustedTransformService transformService;

    @Value("${app.sqs.queue-url}")
    private String queueUrl;

    @Value("${app.sqs.listener.batch-size:5}")
    private int batchSize;

    @Value("${app.sqs.listener.wait-time-seconds:20}")
    private int waitTimeSeconds;

    @Value("${app.sqs.listener.visibility-timeout-seconds:180}")
    private int visibilityTimeoutSeconds;

    public SqsRawObjectListener(SqsClient sqsClient,
                                S3EventNotificationParser notificationParser,
                                RawToTrustedTransformService transformService) {
        this.sqsClient = sqsClient;
        this.notificationParser = notificationParser;
        this.transformService = transformService;
    }

    @Scheduled(fixedDelayString = "${app.sqs.listener.poll-delay-ms:2000}")
    public void pollQueue() {
        try {
            int batch = Math.max(1, Math.min(batchSize, 10));
            ReceiveMessageRequest receiveMessageRequest = ReceiveMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .maxNumberOfMessages(batch)
                    .waitTimeSeconds(waitTimeSeconds)
                    .visibilityTimeout(visibilityTimeoutSeconds)
                    .attributeNamesWithStrings("ApproximateReceiveCount")
                    .build();

            List<Message> messages = sqsClient.receiveMessage(receiveMessageRequest).messages();
            logger.debug("Polled SQS and received {} messages (batch size {}).", messages.size(), batch);

            for (int i = 0; i < messages.size(); i++) {
                Message message = messages.get(i);
                if (i > 0) {
                    // The receive-time window was partly spent on the messages before this one
                    extendVisibility(message, visibilityTimeoutSeconds);
                }
                processMessage(message);
            }
        } catch (Exception e) {
            logger.error("Error polling SQS queue", e);
        }
    }

    void processMessage(Message message) {
        List<S3ObjectRef> objects;
        try {
            objects = notificationParser.parse(message.body());
        } catch (IllegalArgumentException e) {
            logger.warn("Discarding message {} that is not an S3 notification: {}", message.messageId(), e.getMessage());
            deleteMessage(message);
            return;
        }

        TransformStatus status = transformService.transformAll(objects);
        if (status.hasFailures()) {
            int delaySec = computeVisibilityExtensionSeconds(message);
            logger.warn("{} object(s) of message {} failed; leaving it for redelivery in {}s.",
                    status.getFailedFiles(), message.messageId(), delaySec);
            extendVisibility(message, delaySec);
            return;
        }
        deleteMessage(message);
    }

    int computeVisibilityExtensionSeconds(Message message) {
        Map<String, String> attrs = message.attributesAsStrings();
        String receiveCountStr = attrs != null ? attrs.get("ApproximateReceiveCount") : null;
        int receiveCount = 1;
        if (receiveCountStr != null) {
            try {
                receiveCount = Math.max(1, Integer.parseInt(receiveCountStr));
            } catch (NumberFormatException e) {
                logger.debug("Unexpected receive count '{}' on message {}", receiveCountStr, message.messageId());
            }
        }
        int idx = Math.min(receiveCount - 1, REDELIVERY_DELAYS_SECONDS.length - 1);
        return REDELIVERY_DELAYS_SECONDS[idx];
    }

    private void extendVisibility(Message message, int delaySec) {
        try {
            sqsClient.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(message.receiptHandle())
                    .visibilityTimeout(delaySec)
                    .build());
        } catch (Exception visErr) {
            logger.error("Failed to change visibility for message {}: {}", message.messageId(), visErr.getMessage(), visErr);
        }
    }

    private void deleteMessage(Message message) {
        try {
            DeleteMessageRequest deleteMessageRequest = DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(message.receiptHandle())
                    .build();
            sqsClient.deleteMessage(deleteMessageRequest);
            logger.debug("Successfully deleted message {} from the queue.", message.messageId());
        } catch (Exception e) {
            logger.error("Failed to delete message {} from SQS queue: {}", message.messageId(), e.getMessage(), e);
        }
    }
}
