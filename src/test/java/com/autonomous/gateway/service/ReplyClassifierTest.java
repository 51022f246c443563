package com.autonomous.gateway.service;

import com.autonomous.gateway.model.ClassifiedReply;
import com.autonomous.gateway.model.ClassifiedReply.Kind;
import com.autonomous.gateway.model.TaskRecord;
import com.autonomous.gateway.model.TaskResult;
import com.autonomous.gateway.model.TaskState;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReplyClassifierTest {

    private final ReplyClassifier classifier = new ReplyClassifier();

    @Test
    void shouldClassifyMessageAsImmediateCompletion() {
        ClassifiedReply reply = classifier.classify(Replies.message("hello"));

        assertEquals(Kind.IMMEDIATE_MESSAGE, reply.getKind());
        assertEquals(TaskState.COMPLETED, reply.getState());
        assertEquals("hello", reply.getMessage());
    }

    @Test
    void shouldClassifyWorkingTaskAsHandle() {
        ClassifiedReply reply = classifier.classify(Replies.task("remote-7", "working", "thinking"));

        assertEquals(Kind.TASK_HANDLE, reply.getKind());
        assertEquals(TaskState.RUNNING, reply.getState());
        assertEquals("remote-7", reply.getAgentId());
        assertEquals("ctx-1", reply.getSessionId());
        assertEquals("thinking", reply.getMessage());
    }

    @Test
    void shouldMapRemoteTaskStates() {
        assertEquals(TaskState.COMPLETED, classifier.classify(Replies.task("t", "completed", null)).getState());
        assertEquals(TaskState.ERROR, classifier.classify(Replies.task("t", "failed", null)).getState());
        assertEquals(TaskState.ERROR, classifier.classify(Replies.task("t", "rejected", null)).getState());
        assertEquals(TaskState.CANCELLED, classifier.classify(Replies.task("t", "canceled", null)).getState());
        assertEquals(TaskState.RUNNING, classifier.classify(Replies.task("t", "submitted", null)).getState());
        assertEquals(TaskState.RUNNING, classifier.classify(Replies.task("t", "input-required", null)).getState());
    }

    @Test
    void shouldClassifyJsonRpcErrorAsUpstreamError() {
        ClassifiedReply reply = classifier.classify(Replies.error(-32603, "Internal error"));

        assertEquals(Kind.UPSTREAM_ERROR, reply.getKind());
        assertEquals(-32603, reply.getErrorCode());
        assertEquals("Internal error", reply.getErrorMessage());
        assertTrue(reply.isFailure());
        assertFalse(reply.isTaskNotFound());
    }

    @Test
    void shouldRecognizeTaskNotFound() {
        assertTrue(classifier.classify(Replies.error(ClassifiedReply.TASK_NOT_FOUND_CODE, "Task not found")).isTaskNotFound());
    }

    @Test
    void shouldFailLoudOnUnexpectedShapes() {
        ObjectNode odd = Replies.MAPPER.createObjectNode();
        odd.putObject("result").put("kind", "poem").put("text", "roses");
        ObjectNode empty = Replies.MAPPER.createObjectNode();
        empty.put("jsonrpc", "2.0");

        for (ClassifiedReply reply : new ClassifiedReply[] {
            classifier.classify(null),
            classifier.classify(Replies.MAPPER.getNodeFactory().textNode("ok")),
            classifier.classify(odd),
            classifier.classify(empty)
        }) {
            assertEquals(Kind.UNRECOGNIZED, reply.getKind());
            assertEquals(TaskState.ERROR, reply.getState());
            assertNotNull(reply.getErrorMessage());
        }
    }

    @Test
    void shouldClassifyMessageWithoutKindByShape() {
        ObjectNode reply = Replies.MAPPER.createObjectNode();
        ObjectNode result = reply.putObject("result");
        result.put("role", "agent");
        result.putArray("parts").addObject().put("type", "text").put("text", "legacy");

        ClassifiedReply classified = classifier.classify(reply);

        assertEquals(Kind.IMMEDIATE_MESSAGE, classified.getKind());
        assertEquals("legacy", classified.getMessage());
    }

    @Test
    void shouldAppendStreamedArtifacts() {
        TaskRecord record = TaskRecord.builder()
            .gatewayId("g-1")
            .state(TaskState.PENDING)
            .result(TaskResult.placeholder("waiting"))
            .build();

        classifier.classify(Replies.artifactUpdate("remote-1", "a-1", "part one")).applyTo(record, true);
        classifier.classify(Replies.artifactUpdate("remote-1", "a-2", "part two")).applyTo(record, true);

        assertEquals(TaskState.STREAMING, record.getState());
        assertEquals("remote-1", record.getAgentId());
        assertEquals(2, record.getResult().getArtifacts().size());
        assertNull(record.getResult().getNote());

        classifier.classify(Replies.statusUpdate("remote-1", "completed", "all done")).applyTo(record, true);

        assertEquals(TaskState.COMPLETED, record.getState());
        assertEquals("all done", record.getResult().getMessage());
        assertEquals(2, record.getResult().getArtifacts().size());
    }

    @Test
    void shouldNotRecordAgentIdEqualToGatewayId() {
        TaskRecord record = TaskRecord.builder().gatewayId("same").state(TaskState.PENDING).build();

        classifier.classify(Replies.task("same", "working", null)).applyTo(record);

        assertNull(record.getAgentId());
        assertEquals("same", record.getRemoteTaskId());
    }

    @Test
    void shouldWriteUpstreamErrorIntoResult() {
        TaskRecord record = TaskRecord.builder().gatewayId("g-1").state(TaskState.RUNNING).build();

        classifier.classify(Replies.error(-32000, "Agent exploded")).applyTo(record);

        assertEquals(TaskState.ERROR, record.getState());
        assertEquals(-32000, record.getResult().getErrorCode());
        assertEquals("Agent Error: Agent exploded (Code: -32000)", record.getResult().getMessage());
    }
}
