package com.p14n.pubsub.data;

public record TopicInfo(String name) {
}
