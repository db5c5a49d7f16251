package org.gdbdap;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.gdbdap.debug.SourceBreakpoint;
import org.junit.Before;
import org.junit.Test;

public class BreakpointManagerTest {
    static final String MAIN_C = "/src/main.c";
    static final String UTIL_C = "/src/util.c";

    ScriptedGdb gdb = new ScriptedGdb();
    BreakpointManager breakpoints = new BreakpointManager(gdb);
    /** What gdb currently has, as "number path line". */
    List<String[]> table = new ArrayList<>();
    int nextNumber = 1;

    @Before
    public void fakeBreakpointTable() {
        gdb.otherwise(
                command -> {
                    if (command.equals("-break-list")) return List.of(breakList());
                    if (command.startsWith("-break-delete ")) {
                        var number = command.substring("-break-delete ".length());
                        table.removeIf(b -> b[0].equals(number));
                        return List.of("^done");
                    }
                    if (command.startsWith("-break-insert ")) {
                        var location = command.substring(command.lastIndexOf(' ') + 1);
                        if (!location.contains(":")) return List.of("^done,bkpt={number=\"99\",func=\"" + location + "\"}");
                        var path = location.substring(0, location.lastIndexOf(':'));
                        var line = location.substring(location.lastIndexOf(':') + 1);
                        if (line.equals("99")) return List.of("^error,msg=\"No line 99 in file \\\"main.c\\\".\"");
                        var number = Integer.toString(nextNumber++);
                        table.add(new String[] {number, path, line});
                        return List.of(
                                String.format(
                                        "^done,bkpt={number=\"%s\",type=\"breakpoint\",disp=\"keep\",enabled=\"y\",file=\"%s\",fullname=\"%s\",line=\"%s\"}",
                                        number, path.substring(path.lastIndexOf('/') + 1), path, line));
                    }
                    return List.of("^done");
                });
    }

    String breakList() {
        var rows =
                table.stream()
                        .map(
                                b ->
                                        String.format(
                                                "bkpt={number=\"%s\",type=\"breakpoint\",file=\"%s\",fullname=\"%s\",line=\"%s\"}",
                                                b[0], b[1].substring(b[1].lastIndexOf('/') + 1), b[1], b[2]))
                        .collect(Collectors.joining(","));
        return "^done,BreakpointTable={nr_rows=\""
                + table.size()
                + "\",nr_cols=\"6\",hdr=[{width=\"7\",alignment=\"-1\",col_name=\"number\",colhdr=\"Num\"}],body=["
                + rows
                + "]}";
    }

    List<String> linesIn(String path) {
        return table.stream().filter(b -> b[1].equals(path)).map(b -> b[2]).collect(Collectors.toList());
    }

    @Test
    public void setBreakpointsIsIdempotent() {
        var specs = List.of(new SourceBreakpoint(10), new SourceBreakpoint(20));
        breakpoints.setBreakpoints(MAIN_C, specs);
        var again = breakpoints.setBreakpoints(MAIN_C, specs);

        assertTrue(again.success);
        assertThat(linesIn(MAIN_C), containsInAnyOrder("10", "20"));
        assertThat(gdb.sent, hasItems("-break-delete 1", "-break-delete 2"));
        assertThat(again.breakpoints, hasSize(2));
        assertTrue(again.breakpoints.get(0).verified);
        assertThat(again.breakpoints.get(0).id, equalTo(3));
        assertThat(again.breakpoints.get(1).line, equalTo(20));
        assertThat(again.breakpoints.get(1).source.path, equalTo(MAIN_C));
    }

    @Test
    public void otherFilesAreUntouched() {
        breakpoints.setBreakpoints(UTIL_C, List.of(new SourceBreakpoint(5)));
        breakpoints.setBreakpoints(MAIN_C, List.of(new SourceBreakpoint(10)));
        breakpoints.setBreakpoints(MAIN_C, List.of());

        assertThat(linesIn(UTIL_C), contains("5"));
        assertThat(linesIn(MAIN_C), empty());
        assertThat(breakpoints.breakpoints(MAIN_C), empty());
        assertThat(breakpoints.breakpoints(UTIL_C), hasSize(1));
    }

    @Test
    public void eachInsertionVerifiedOnItsOwn() {
        var result = breakpoints.setBreakpoints(MAIN_C, List.of(new SourceBreakpoint(99), new SourceBreakpoint(12)));

        assertTrue(result.success);
        assertFalse(result.breakpoints.get(0).verified);
        assertThat(result.breakpoints.get(0).message, equalTo("Error from GDB: No line 99 in file \"main.c\"."));
        assertThat(result.breakpoints.get(0).id, nullValue());
        assertTrue(result.breakpoints.get(1).verified);
        assertThat(linesIn(MAIN_C), contains("12"));
    }

    @Test
    public void conditionalBreakpoint() {
        var spec = new SourceBreakpoint(10);
        spec.condition = "i > 3";
        breakpoints.setBreakpoints(MAIN_C, List.of(spec));
        assertThat(gdb.sent, hasItem("-break-insert -c \"i > 3\" /src/main.c:10"));
    }

    @Test
    public void clearFailsWhenListFails() {
        gdb.reply("-break-list", "^error,msg=\"gdb is busy\"");
        var result = breakpoints.setBreakpoints(MAIN_C, List.of(new SourceBreakpoint(10)));
        assertFalse(result.success);
        assertThat(result.message, equalTo("Error from GDB: gdb is busy"));
        assertThat(gdb.sent, not(hasItem(startsWith("-break-insert"))));
    }

    @Test
    public void breakpointLocations() {
        gdb.reply(
                "-symbol-list-lines /src/main.c",
                "^done,lines=[{pc=\"0x401126\",line=\"5\"},{pc=\"0x40112e\",line=\"7\"},{pc=\"0x401135\",line=\"7\"},{pc=\"0x401140\",line=\"12\"}]");

        assertThat(breakpoints.getBreakpointLocations(MAIN_C, 5, null), contains(5));
        assertThat(breakpoints.getBreakpointLocations(MAIN_C, 5, 10), contains(5, 7));
        assertThat(breakpoints.getBreakpointLocations(MAIN_C, 6, 6), empty());
    }

    @Test
    public void breakOnMain() {
        assertTrue(breakpoints.setBreakpointOnMain().success);
        assertThat(gdb.sent, contains("-break-insert main"));
    }
}
