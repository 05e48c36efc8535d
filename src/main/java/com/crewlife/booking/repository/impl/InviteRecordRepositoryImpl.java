package com.crewlife.booking.repository.impl;

import com.crewlife.booking.exception.RepositoryException;
import com.crewlife.booking.model.InviteLock;
import com.crewlife.booking.model.InviteRecord;
import com.crewlife.booking.model.OtpStatus;
import com.crewlife.booking.model.TokenStatus;
import com.crewlife.booking.repository.InviteRecordRepository;
import com.crewlife.booking.util.InstantAsLongAttributeConverter;
import com.crewlife.booking.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * DynamoDB implementation of {@link InviteRecordRepository} using the low-level client
 * for queries and conditional updates, and the bean schema for item mapping.
 */
@Repository
public class InviteRecordRepositoryImpl implements InviteRecordRepository {

    private static final Logger logger = LoggerFactory.getLogger(InviteRecordRepositoryImpl.class);

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<InviteRecord> recordSchema;
    private final QueryPerformanceTracker queryTracker;
    private final String tableName;

    @Autowired
    public InviteRecordRepositoryImpl(DynamoDbClient dynamoDbClient,
                                      QueryPerformanceTracker queryTracker,
                                      @Value("${booking.dynamodb.table-name:InviteRecords}") String tableName) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.tableName = tableName;
        this.recordSchema = TableSchema.fromBean(InviteRecord.class);
    }

    @Override
    public void append(InviteRecord record) {
        queryTracker.trackQuery("PutItem", tableName, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(recordSchema.itemToMap(record, true))
                    .conditionExpression("attribute_not_exists(rowId)")
                    .build());
                logger.debug("Appended invite row {}", record.getRowId());
                return null;

            } catch (ConditionalCheckFailedException e) {
                throw new RepositoryException("Invite row already exists: " + record.getRowId(), e);
            } catch (DynamoDbException e) {
                logger.error("Failed to append invite row {}", record.getRowId(), e);
                throw new RepositoryException("Failed to append invite row", e);
            }
        });
    }

    @Override
    public void save(InviteRecord record) {
        queryTracker.trackQuery("PutItem", tableName, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(recordSchema.itemToMap(record, true))
                    .build());
                logger.debug("Saved invite row {}", record.getRowId());
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to save invite row {}", record.getRowId(), e);
                throw new RepositoryException("Failed to save invite row", e);
            }
        });
    }

    @Override
    public Optional<InviteRecord> findById(String rowId) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(rowKey(rowId))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(recordSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to read invite row {}", rowId, e);
                throw new RepositoryException("Failed to read invite row", e);
            }
        });
    }

    @Override
    public Optional<InviteRecord> findByTokenHash(String tokenHash) {
        Optional<String> rowId = queryTracker.trackQuery("Query", tableName, () -> {
            try {
                QueryResponse response = dynamoDbClient.query(QueryRequest.builder()
                    .tableName(tableName)
                    .indexName(InviteRecord.TOKEN_INDEX)
                    .keyConditionExpression("tokenHash = :tokenHash")
                    .expressionAttributeValues(Map.of(
                        ":tokenHash", AttributeValue.builder().s(tokenHash).build()
                    ))
                    .limit(1)
                    .build());

                if (response.items().isEmpty()) {
                    return Optional.<String>empty();
                }
                return Optional.of(response.items().get(0).get("rowId").s());

            } catch (DynamoDbException e) {
                logger.error("Failed to query invite rows by token hash", e);
                throw new RepositoryException("Failed to find invite row by token", e);
            }
        });
        // Index reads are eventually consistent; re-read the base row before anyone decides on it.
        return rowId.flatMap(this::findById);
    }

    @Override
    public List<InviteRecord> findByIdentityKey(String identityKey) {
        return queryNewestFirst(InviteRecord.IDENTITY_INDEX, "identityKey", identityKey);
    }

    @Override
    public List<InviteRecord> findByCandidateKey(String candidateKey) {
        return queryNewestFirst(InviteRecord.CANDIDATE_INDEX, "candidateKey", candidateKey);
    }

    private List<InviteRecord> queryNewestFirst(String indexName, String keyAttribute, String keyValue) {
        return queryTracker.trackQuery("Query", tableName, () -> {
            try {
                List<InviteRecord> records = new ArrayList<>();
                Map<String, AttributeValue> lastKey = null;
                do {
                    QueryRequest.Builder request = QueryRequest.builder()
                        .tableName(tableName)
                        .indexName(indexName)
                        .keyConditionExpression("#key = :key")
                        .expressionAttributeNames(Map.of("#key", keyAttribute))
                        .expressionAttributeValues(Map.of(
                            ":key", AttributeValue.builder().s(keyValue).build()
                        ))
                        .scanIndexForward(false);
                    if (lastKey != null) {
                        request.exclusiveStartKey(lastKey);
                    }
                    QueryResponse response = dynamoDbClient.query(request.build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        records.add(recordSchema.mapToItem(item));
                    }
                    lastKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
                } while (lastKey != null);

                logger.debug("Found {} invite rows on {}", records.size(), indexName);
                return records;

            } catch (DynamoDbException e) {
                logger.error("Failed to query invite rows on {}", indexName, e);
                throw new RepositoryException("Failed to query invite rows", e);
            }
        });
    }

    @Override
    public boolean compareAndSetTokenStatus(String rowId, Set<TokenStatus> expected, TokenStatus next, Instant at) {
        if (expected.isEmpty() || !expected.stream().allMatch(status -> status.canTransitionTo(next))) {
            throw new IllegalArgumentException("Illegal token transition " + expected + " -> " + next);
        }
        return queryTracker.trackQuery("UpdateItem", tableName, () -> {
            Map<String, String> names = new HashMap<>();
            Map<String, AttributeValue> values = new HashMap<>();
            names.put("#status", "tokenStatus");
            names.put("#updatedAt", "updatedAt");
            values.put(":next", AttributeValue.builder().s(next.name()).build());
            values.put(":at", InstantAsLongAttributeConverter.toAttributeValue(at));

            StringBuilder update = new StringBuilder("SET #status = :next, #updatedAt = :at");
            if (next == TokenStatus.USED) {
                names.put("#stamp", "usedAt");
                update.append(", #stamp = :at");
            } else if (next == TokenStatus.REVOKED) {
                names.put("#stamp", "revokedAt");
                update.append(", #stamp = :at");
            }

            List<String> placeholders = new ArrayList<>();
            int i = 0;
            for (TokenStatus status : expected) {
                String placeholder = ":expected" + i++;
                placeholders.add(placeholder);
                values.put(placeholder, AttributeValue.builder().s(status.name()).build());
            }

            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(rowKey(rowId))
                    .updateExpression(update.toString())
                    .conditionExpression("attribute_exists(rowId) AND #status IN (" + String.join(", ", placeholders) + ")")
                    .expressionAttributeNames(names)
                    .expressionAttributeValues(values)
                    .build());
                logger.debug("Token of row {} moved to {}", rowId, next);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Token status of row {} changed concurrently; {} not applied", rowId, next);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to update token status of row {}", rowId, e);
                throw new RepositoryException("Failed to update token status", e);
            }
        });
    }

    @Override
    public boolean updatePendingOtp(String rowId, OtpStatus next, int attempts, Instant at) {
        return queryTracker.trackQuery("UpdateItem", tableName, () -> {
            Map<String, String> names = new HashMap<>();
            Map<String, AttributeValue> values = new HashMap<>();
            names.put("#otpStatus", "otpStatus");
            names.put("#otpAttempts", "otpAttempts");
            names.put("#updatedAt", "updatedAt");
            values.put(":next", AttributeValue.builder().s(next.name()).build());
            values.put(":pending", AttributeValue.builder().s(OtpStatus.PENDING.name()).build());
            values.put(":attempts", AttributeValue.builder().n(String.valueOf(attempts)).build());
            values.put(":at", InstantAsLongAttributeConverter.toAttributeValue(at));

            String update = "SET #otpStatus = :next, #otpAttempts = :attempts, #updatedAt = :at";
            if (next == OtpStatus.VERIFIED) {
                names.put("#verifiedAt", "verifiedAt");
                update += ", #verifiedAt = :at";
            }

            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(rowKey(rowId))
                    .updateExpression(update)
                    .conditionExpression("attribute_exists(rowId) AND #otpStatus = :pending")
                    .expressionAttributeNames(names)
                    .expressionAttributeValues(values)
                    .build());
                logger.debug("Code of row {} moved to {} ({} attempts)", rowId, next, attempts);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Code of row {} settled concurrently; {} not applied", rowId, next);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to update code status of row {}", rowId, e);
                throw new RepositoryException("Failed to update code status", e);
            }
        });
    }

    @Override
    public boolean attachToken(String rowId, String tokenHash, Instant tokenExpiry, Instant at) {
        return queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(rowKey(rowId))
                    .updateExpression("SET #tokenHash = :hash, #tokenExpiry = :expiry, "
                        + "#tokenStatus = :issued, #updatedAt = :at")
                    .conditionExpression("attribute_exists(rowId) AND #otpStatus = :verified "
                        + "AND attribute_not_exists(#tokenStatus)")
                    .expressionAttributeNames(Map.of(
                        "#tokenHash", "tokenHash",
                        "#tokenExpiry", "tokenExpiry",
                        "#tokenStatus", "tokenStatus",
                        "#otpStatus", "otpStatus",
                        "#updatedAt", "updatedAt"
                    ))
                    .expressionAttributeValues(Map.of(
                        ":hash", AttributeValue.builder().s(tokenHash).build(),
                        ":expiry", InstantAsLongAttributeConverter.toAttributeValue(tokenExpiry),
                        ":issued", AttributeValue.builder().s(TokenStatus.ISSUED.name()).build(),
                        ":verified", AttributeValue.builder().s(OtpStatus.VERIFIED.name()).build(),
                        ":at", InstantAsLongAttributeConverter.toAttributeValue(at)
                    ))
                    .build());
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Row {} already carries a token; new token not attached", rowId);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to attach token to row {}", rowId, e);
                throw new RepositoryException("Failed to attach access token", e);
            }
        });
    }

    @Override
    public void updateLock(String rowId, InviteLock lock, Instant at) {
        queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(rowKey(rowId))
                    .updateExpression("SET #locked = :lock, #lockedAt = :at, #updatedAt = :at")
                    .conditionExpression("attribute_exists(rowId)")
                    .expressionAttributeNames(Map.of(
                        "#locked", "locked",
                        "#lockedAt", "lockedAt",
                        "#updatedAt", "updatedAt"
                    ))
                    .expressionAttributeValues(Map.of(
                        ":lock", AttributeValue.builder().s(lock.name()).build(),
                        ":at", InstantAsLongAttributeConverter.toAttributeValue(at)
                    ))
                    .build());
                return null;

            } catch (ConditionalCheckFailedException e) {
                throw new RepositoryException("Invite row not found: " + rowId, e);
            } catch (DynamoDbException e) {
                logger.error("Failed to update lock of row {}", rowId, e);
                throw new RepositoryException("Failed to update invite lock", e);
            }
        });
    }

    @Override
    public void applyUnlockOverride(String rowId, String actor, String reason, Instant at) {
        queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(rowKey(rowId))
                    .updateExpression("SET #locked = :unlock, #unlockedBy = :actor, #unlockReason = :reason, "
                        + "#unlockedAt = :at, #updatedAt = :at")
                    .conditionExpression("attribute_exists(rowId)")
                    .expressionAttributeNames(Map.of(
                        "#locked", "locked",
                        "#unlockedBy", "unlockedBy",
                        "#unlockReason", "unlockReason",
                        "#unlockedAt", "unlockedAt",
                        "#updatedAt", "updatedAt"
                    ))
                    .expressionAttributeValues(Map.of(
                        ":unlock", AttributeValue.builder().s(InviteLock.UNLOCK.name()).build(),
                        ":actor", AttributeValue.builder().s(actor).build(),
                        ":reason", AttributeValue.builder().s(reason).build(),
                        ":at", InstantAsLongAttributeConverter.toAttributeValue(at)
                    ))
                    .build());
                return null;

            } catch (ConditionalCheckFailedException e) {
                throw new RepositoryException("Invite row not found: " + rowId, e);
            } catch (DynamoDbException e) {
                logger.error("Failed to apply unlock override to row {}", rowId, e);
                throw new RepositoryException("Failed to apply unlock override", e);
            }
        });
    }

    private Map<String, AttributeValue> rowKey(String rowId) {
        return Map.of("rowId", AttributeValue.builder().s(rowId).build());
    }
}
