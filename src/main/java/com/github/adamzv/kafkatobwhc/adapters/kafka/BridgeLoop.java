package com.github.adamzv.kafkatobwhc.adapters.kafka;

import com.github.adamzv.kafkatobwhc.application.ForwardRecordUseCase;
import com.github.adamzv.kafkatobwhc.domain.BridgeConfig;
import com.github.adamzv.kafkatobwhc.domain.InboundRecord;
import com.github.adamzv.kafkatobwhc.domain.ProblemException;
import com.github.adamzv.kafkatobwhc.domain.Problems;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.kafka.clients.consumer.CommitFailedException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RebalanceInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes the inbound topic and forwards record by record. The offset of a record is
 * committed only after its response was published, so a crash leads to redelivery, never to
 * a lost response.
 *
 * <p>The consumer is owned by the thread running {@link #run()} and closed by it.
 */
public class BridgeLoop implements Runnable {

  private static final Logger log = LoggerFactory.getLogger(BridgeLoop.class);

  private static final Duration POLL_TIMEOUT = Duration.ofMillis(300);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final Consumer<byte[], byte[]> consumer;
  private final ForwardRecordUseCase forwardRecordUseCase;
  private final BridgeConfig config;
  private final BridgeFaultHandler faultHandler;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final CountDownLatch terminated = new CountDownLatch(1);

  public BridgeLoop(
      Consumer<byte[], byte[]> consumer,
      ForwardRecordUseCase forwardRecordUseCase,
      BridgeConfig config,
      BridgeFaultHandler faultHandler) {
    this.consumer = consumer;
    this.forwardRecordUseCase = forwardRecordUseCase;
    this.config = config;
    this.faultHandler = faultHandler;
  }

  @Override
  public void run() {
    ProblemException fault = null;
    long processed = 0;
    try {
      consumer.subscribe(List.of(config.inboundTopic()), new LoggingRebalanceListener());
      log.info("bridge_started topic={} groupId={}", config.inboundTopic(), config.groupId());
      while (running.get()) {
        ConsumerRecords<byte[], byte[]> records = poll();
        Map<TopicPartition, Long> nextOffsets = firstOffsets(records);
        for (ConsumerRecord<byte[], byte[]> record : records) {
          // uncommitted rest of the batch is redelivered after restart
          if (!running.get()) {
            break;
          }
          forwardRecordUseCase.execute(toInbound(record));
          processed++;
          TopicPartition partition = new TopicPartition(record.topic(), record.partition());
          nextOffsets.put(partition, record.offset() + 1);
          if (!commit(partition, record.offset())) {
            rewind(nextOffsets);
            break;
          }
        }
      }
    } catch (ProblemException ex) {
      fault = ex;
    } catch (RuntimeException ex) {
      fault = Problems.operationFailed(
          "Unexpected failure in bridge loop",
          Map.of("error", ex.getClass().getSimpleName(), "message", String.valueOf(ex.getMessage())),
          ex
      );
    } finally {
      running.set(false);
      closeConsumer();
      terminated.countDown();
    }

    if (fault != null) {
      log.error(
          "bridge_fault code={} message={} details={} processed={}",
          fault.problem().code(),
          fault.problem().message(),
          fault.problem().details(),
          processed,
          fault
      );
      faultHandler.onFault(fault);
    } else {
      log.info("bridge_stopped topic={} processed={}", config.inboundTopic(), processed);
    }
  }

  /**
   * Stops accepting records. The record in flight is still published and committed.
   */
  public void stop() {
    running.set(false);
  }

  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isTerminated() {
    return terminated.getCount() == 0;
  }

  private ConsumerRecords<byte[], byte[]> poll() {
    try {
      return consumer.poll(POLL_TIMEOUT);
    } catch (KafkaException ex) {
      throw Problems.kafkaUnavailable("Kafka poll failed", errorDetails(Map.of(), ex), ex);
    }
  }

  private boolean commit(TopicPartition partition, long offset) {
    Map<TopicPartition, OffsetAndMetadata> offsets = Map.of(partition, new OffsetAndMetadata(offset + 1));
    try {
      consumer.commitSync(offsets);
      return true;
    } catch (CommitFailedException | RebalanceInProgressException ex) {
      // already published; whoever owns the partition next re-reads it
      log.warn(
          "commit_skipped partition={} offset={} error={}",
          partition,
          offset,
          ex.getClass().getSimpleName()
      );
      return false;
    } catch (KafkaException ex) {
      throw Problems.kafkaUnavailable(
          "Kafka commit failed",
          errorDetails(Map.of("partition", partition.toString(), "offset", offset), ex),
          ex
      );
    }
  }

  // partitions kept across the rebalance resume at the first record not forwarded yet
  private void rewind(Map<TopicPartition, Long> nextOffsets) {
    Set<TopicPartition> assigned = consumer.assignment();
    nextOffsets.forEach((partition, offset) -> {
      if (assigned.contains(partition)) {
        consumer.seek(partition, offset);
      }
    });
    log.debug("batch_abandoned positions={}", nextOffsets);
  }

  private static Map<TopicPartition, Long> firstOffsets(ConsumerRecords<byte[], byte[]> records) {
    Map<TopicPartition, Long> offsets = new HashMap<>();
    for (TopicPartition partition : records.partitions()) {
      offsets.put(partition, records.records(partition).get(0).offset());
    }
    return offsets;
  }

  private void closeConsumer() {
    try {
      consumer.close(CLOSE_TIMEOUT);
    } catch (KafkaException ex) {
      log.warn("consumer_close_failed error={} message={}", ex.getClass().getSimpleName(), ex.getMessage());
    }
  }

  private Map<String, Object> errorDetails(Map<String, Object> context, KafkaException ex) {
    Map<String, Object> details = new HashMap<>(context);
    details.put("topic", config.inboundTopic());
    details.put("bootstrapServers", config.bootstrapServers());
    details.put("error", ex.getClass().getSimpleName());
    if (ex.getMessage() != null) {
      details.put("message", ex.getMessage());
    }
    return Map.copyOf(details);
  }

  private static InboundRecord toInbound(ConsumerRecord<byte[], byte[]> record) {
    return new InboundRecord(
        record.key(),
        record.value(),
        record.topic(),
        record.partition(),
        record.offset()
    );
  }

  private static final class LoggingRebalanceListener implements ConsumerRebalanceListener {

    @Override
    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
      log.debug("partitions_revoked partitions={}", partitions);
    }

    @Override
    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
      log.debug("partitions_assigned partitions={}", partitions);
    }
  }
}
