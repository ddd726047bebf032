package com.example.support.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "support")
public class SupportProperties {

    @NestedConfigurationProperty
    private final Staff staff = new Staff();

    @NestedConfigurationProperty
    private final Intake intake = new Intake();

    @NestedConfigurationProperty
    private final Storage storage = new Storage();

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final SocketIo socketIo = new SocketIo();

    public Staff getStaff() {
        return staff;
    }

    public Intake getIntake() {
        return intake;
    }

    public Storage getStorage() {
        return storage;
    }

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public SocketIo getSocketIo() {
        return socketIo;
    }

    @Validated
    public static class Staff {

        /**
         * Identifier of the staff group hosting one discussion thread per ticket.
         */
        private String groupId = "support-staff";

        /**
         * Reference time zone of the support team.
         */
        private String timeZone = "Asia/Yakutsk";

        /**
         * First staffed hour of the day, inclusive.
         */
        private int workdayStartHour = 8;

        /**
         * Last staffed hour of the day, inclusive.
         */
        private int workdayEndHour = 23;

        public String getGroupId() {
            return groupId;
        }

        public void setGroupId(String groupId) {
            this.groupId = groupId;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        public int getWorkdayStartHour() {
            return workdayStartHour;
        }

        public void setWorkdayStartHour(int workdayStartHour) {
            this.workdayStartHour = workdayStartHour;
        }

        public int getWorkdayEndHour() {
            return workdayEndHour;
        }

        public void setWorkdayEndHour(int workdayEndHour) {
            this.workdayEndHour = workdayEndHour;
        }
    }

    @Validated
    public static class Intake {

        /**
         * Number of recent orders offered when a category needs order context.
         */
        private int recentOrderLimit = 3;

        /**
         * Lifetime of an abandoned intake conversation.
         */
        private Duration stateTtl = Duration.ofHours(24);

        /**
         * Location of the FAQ menu definition.
         */
        private String menuLocation = "classpath:support-menu.json";

        public int getRecentOrderLimit() {
            return recentOrderLimit;
        }

        public void setRecentOrderLimit(int recentOrderLimit) {
            this.recentOrderLimit = recentOrderLimit;
        }

        public Duration getStateTtl() {
            return stateTtl;
        }

        public void setStateTtl(Duration stateTtl) {
            this.stateTtl = stateTtl;
        }

        public String getMenuLocation() {
            return menuLocation;
        }

        public void setMenuLocation(String menuLocation) {
            this.menuLocation = menuLocation;
        }
    }

    @Validated
    public static class Storage {

        /**
         * Total attempts for a storage call failing with transient errors.
         */
        private int maxAttempts = 3;

        /**
         * Delay before the first retry; the n-th retry waits n times this value.
         */
        private Duration retryBaseDelay = Duration.ofMillis(500);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryBaseDelay() {
            return retryBaseDelay;
        }

        public void setRetryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
        }
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the router.
         */
        private String keyPrefix = "support";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic receiving ticket lifecycle events.
         */
        private String ticketTopic = "support.tickets";

        private int partitions = 6;

        private int replicas = 1;

        public String getTicketTopic() {
            return ticketTopic;
        }

        public void setTicketTopic(String ticketTopic) {
            this.ticketTopic = ticketTopic;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public int getReplicas() {
            return replicas;
        }

        public void setReplicas(int replicas) {
            this.replicas = replicas;
        }
    }

    @Validated
    public static class SocketIo {

        private String host = "0.0.0.0";

        private int port = 9094;

        /**
         * Value of the Access-Control-Allow-Origin header for polling clients.
         */
        private String origin = "*";

        private Duration pingInterval = Duration.ofSeconds(25);

        private Duration pingTimeout = Duration.ofSeconds(60);

        /**
         * Largest accepted websocket frame in bytes; media captions and contact cards stay well below it.
         */
        private int maxFramePayloadLength = 64 * 1024;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getOrigin() {
            return origin;
        }

        public void setOrigin(String origin) {
            this.origin = origin;
        }

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }

        public Duration getPingTimeout() {
            return pingTimeout;
        }

        public void setPingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
        }

        public int getMaxFramePayloadLength() {
            return maxFramePayloadLength;
        }

        public void setMaxFramePayloadLength(int maxFramePayloadLength) {
            this.maxFramePayloadLength = maxFramePayloadLength;
        }
    }
}
