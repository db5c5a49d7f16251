package org.gdbdap;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import com.google.common.util.concurrent.MoreExecutors;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.gdbdap.mi.MiParser;
import org.gdbdap.mi.MiRecord;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class InferiorOrchestratorTest {
    static final String THREE_GROUPS =
            "^done,groups=[{id=\"i1\",type=\"process\",pid=\"1111\",executable=\"/bin/a\"},{id=\"i2\",type=\"process\",pid=\"1234\",executable=\"/bin/x\"},{id=\"i3\",type=\"process\",pid=\"3333\"}]";
    static final String TWO_GROUPS =
            "^done,groups=[{id=\"i1\",type=\"process\",pid=\"1111\"},{id=\"i2\",type=\"process\",pid=\"1234\"}]";

    @Rule public TemporaryFolder temp = new TemporaryFolder();

    ScriptedGdb gdb = new ScriptedGdb();
    MockClient client = new MockClient();
    EventTranslator events = new EventTranslator(client, MoreExecutors.directExecutor());
    InferiorOrchestrator inferiors = new InferiorOrchestrator(gdb, events);

    static String threadInfo(String targetId) {
        return "^done,threads=[{id=\"1\",target-id=\""
                + targetId
                + "\",name=\"prog\",state=\"stopped\",core=\"0\"}],current-thread-id=\"1\"";
    }

    @Test
    public void attachKeepsOnlyTheTarget() throws IOException {
        var program = temp.newFile("x").getPath();
        gdb.reply("-list-thread-groups", THREE_GROUPS);

        var result = inferiors.attach(1234, program);

        assertTrue(result.message, result.success);
        assertThat(
                gdb.sent,
                contains(
                        "-list-thread-groups",
                        "-list-thread-groups",
                        "inferior 2",
                        "-list-thread-groups",
                        "detach inferior 1",
                        "detach inferior 3",
                        "file " + program));
    }

    @Test
    public void attachUntrackedProcess() {
        gdb.reply("-list-thread-groups", "^done,groups=[{id=\"i1\",type=\"process\"}]");
        gdb.reply("-list-thread-groups", "^done,groups=[{id=\"i1\",type=\"process\",pid=\"77\"}]");

        var result = inferiors.attach(77, null);

        assertTrue(result.message, result.success);
        assertThat(gdb.sent, contains("-list-thread-groups", "attach 77", "-list-thread-groups", "inferior 1", "-list-thread-groups"));
    }

    @Test
    public void attachFailure() {
        gdb.reply("-list-thread-groups", "^done,groups=[]");
        gdb.reply("attach 99", "^error,msg=\"ptrace: Operation not permitted.\"");

        var result = inferiors.attach(99, null);

        assertFalse(result.success);
        assertThat(result.message, equalTo("Failed to attach to PID 99: Error from GDB: ptrace: Operation not permitted."));
    }

    @Test
    public void attachedProcessMissing() {
        gdb.reply("-list-thread-groups", "^done,groups=[{id=\"i1\",type=\"process\"}]");

        var result = inferiors.attach(99, null);

        assertThat(result.message, equalTo("Failed to attach to PID 99: No inferior found for PID 99"));
    }

    @Test
    public void attachWithMissingProgram() {
        gdb.reply("-list-thread-groups", THREE_GROUPS);

        var result = inferiors.attach(1234, "/does/not/exist");

        assertFalse(result.success);
        assertThat(result.message, equalTo("Failed to attach to PID 1234: The path /does/not/exist does not exist"));
    }

    @Test
    public void attachStopsAtFirstFailedDetach() {
        gdb.reply("-list-thread-groups", THREE_GROUPS);
        gdb.reply("detach inferior 1", "^error,msg=\"Inferior 1 is not running.\"");

        var result = inferiors.attach(1234, null);

        assertFalse(result.success);
        assertThat(
                result.message,
                equalTo("Failed to attach to PID 1234: Failed to detach inferior i1: Error from GDB: Inferior 1 is not running."));
        assertThat(gdb.sent, not(hasItem("detach inferior 3")));
    }

    @Test
    public void parseAddedInferior() {
        var records = new ArrayList<MiRecord>();
        for (var line : List.of("=thread-group-added,id=\"i4\"", "~\"[New inferior 4]\\n\"", "~\"Added inferior 4\\n\"", "^done")) {
            records.add(MiParser.parse(line).get());
        }
        assertThat(InferiorOrchestrator.parseAddedInferior(records), equalTo(Optional.of(4)));
        assertThat(InferiorOrchestrator.parseAddedInferior(List.of(MiParser.parse("^done").get())), equalTo(Optional.empty()));
    }

    @Test
    public void pidFromTargetId() {
        assertThat(InferiorOrchestrator.pidFromTargetId("Thread 1234.1234"), equalTo(Optional.of(1234)));
        assertThat(InferiorOrchestrator.pidFromTargetId("Thread 0x7ffff7d89740 (LWP 4321)"), equalTo(Optional.of(4321)));
        assertThat(InferiorOrchestrator.pidFromTargetId("process 77"), equalTo(Optional.empty()));
    }

    @Test
    public void addInferiorsQuietly() {
        var gateDuringAttach = new ArrayList<Boolean>();
        events.enable();
        gdb.reply("-list-thread-groups", TWO_GROUPS);
        gdb.reply("-thread-info", threadInfo("Thread 1234.1234"));
        gdb.reply("add-inferior", "=thread-group-added,id=\"i3\"", "~\"[New inferior 3]\\n\"", "~\"Added inferior 3\\n\"", "^done");
        gdb.otherwise(
                command -> {
                    if (command.startsWith("attach")) gateDuringAttach.add(events.isEnabled());
                    return List.of("^done");
                });

        var result = inferiors.addInferiorsWithPids(List.of(555));

        assertTrue(result.message, result.success);
        assertThat(gdb.sent.subList(gdb.sent.size() - 4, gdb.sent.size()), contains("add-inferior", "inferior 3", "attach 555", "inferior 2"));
        assertThat(gateDuringAttach, contains(false));
        assertTrue(events.isEnabled());
    }

    @Test
    public void addNothing() {
        assertTrue(inferiors.addInferiorsWithPids(List.of()).success);
        assertThat(gdb.sent, empty());
    }

    @Test
    public void detachCurrentSwitchesToSurvivor() {
        gdb.reply("-list-thread-groups", TWO_GROUPS);
        gdb.reply("-thread-info", threadInfo("Thread 1234.1234"));
        gdb.reply("-thread-info", threadInfo("Thread 1111.1111"));

        var current = inferiors.detachInferiors(List.of(1234));

        assertThat(current, equalTo(Optional.of(1111)));
        var i = gdb.sent.indexOf("inferior 1");
        assertThat(i, greaterThan(-1));
        assertThat(gdb.sent.indexOf("detach inferior 2"), greaterThan(i));
        assertThat(gdb.sent.indexOf("remove-inferior 2"), greaterThan(gdb.sent.indexOf("detach inferior 2")));
        assertThat(gdb.sent, not(hasItem("detach inferior 1")));
    }

    @Test
    public void detachLastInferior() {
        gdb.reply("-list-thread-groups", "^done,groups=[{id=\"i1\",type=\"process\",pid=\"1111\"}]");
        gdb.reply("-thread-info", threadInfo("Thread 1111.1111"));

        inferiors.detachInferiors(List.of(1111));

        assertThat(gdb.sent, hasItems("detach", "detach inferior 1", "remove-inferior 1"));
    }

    @Test
    public void selectInferior() {
        gdb.reply("-list-thread-groups", TWO_GROUPS);
        assertTrue(inferiors.selectInferior(1111));
        assertThat(gdb.sent, hasItem("inferior 1"));
        assertFalse(inferiors.selectInferior(4444));
    }

    @Test
    public void currentPidFallsBackToFirstInferior() {
        gdb.reply("-thread-info", "^done,threads=[]");
        gdb.reply("-list-thread-groups", TWO_GROUPS);
        assertThat(inferiors.currentPid(), equalTo(Optional.of(1111)));
    }

    @Test
    public void listInferiorsFlagsCurrent() {
        gdb.reply("-list-thread-groups", "^done,groups=[{id=\"i1\",type=\"process\",pid=\"1111\"},{id=\"i2\",type=\"process\",pid=\"1234\"},{id=\"i3\",type=\"process\"}]");
        gdb.reply("-thread-info", threadInfo("Thread 0x7ffff7d89740 (LWP 1234)"));

        var listed = inferiors.listInferiors();

        assertThat(listed, hasSize(2));
        assertFalse(listed.get(0).current);
        assertTrue(listed.get(1).current);
        assertThat(listed.get(1).number, equalTo(2));
    }

    @Test
    public void listProcesses() {
        gdb.reply(
                "-info-os processes",
                "^done,OSDataTable={nr_rows=\"2\",nr_cols=\"4\",hdr=[{width=\"5\",alignment=\"-1\",col_name=\"col0\",colhdr=\"pid\"}],body=[item={col0=\"1\",col1=\"init\",col2=\"root\",col3=\"0\"},item={col0=\"42\",col1=\"prog\",col2=\"me\",col3=\"1\"}]}");

        var listing = inferiors.listProcesses();

        assertTrue(listing.result.success);
        assertThat(listing.processes, hasSize(2));
        assertThat(listing.processes.get(1).name, equalTo("prog"));
        assertThat(inferiors.pidByName("prog"), equalTo(Optional.of(42)));
        assertThat(inferiors.pidByName("missing"), equalTo(Optional.empty()));
    }
}
