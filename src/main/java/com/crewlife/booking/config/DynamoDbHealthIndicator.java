package com.crewlife.booking.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports whether the invite row store is reachable and active.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient,
                                   @Value("${booking.dynamodb.table-name:InviteRecords}") String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.tableName = tableName;
    }

    @Override
    public Health health() {
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(tableName).build()
            );
            TableStatus status = response.table().tableStatus();

            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("table", tableName)
                    .withDetail("status", status.toString())
                    .withDetail("gsiCount", response.table().globalSecondaryIndexes().size())
                    .build();
            }
            return Health.down()
                .withDetail("table", tableName)
                .withDetail("status", String.valueOf(status))
                .withReason(tableName + " not active")
                .build();

        } catch (DynamoDbException e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
