package io.fileeventstore.aggregate;

public sealed interface HouseEvent {

    record HouseCreated(String id, String name) implements HouseEvent {}

    record HouseRenamed(String newName) implements HouseEvent {}
}
