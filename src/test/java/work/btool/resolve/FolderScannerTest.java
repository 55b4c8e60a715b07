package work.btool.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.btool.shared.ConfigurationException;
import work.btool.shared.Diagnostic;
import work.btool.support.BtoolTestSupport;

class FolderScannerTest {
    @Test
    void namesInstancesAfterTheFileWithoutItsLastExtension() {
        assertEquals("graph.col", FolderScanner.instanceName("graph.col.lp", false));
        assertEquals("graph", FolderScanner.instanceName("graph.col.lp", true));
        assertEquals("x", FolderScanner.instanceName("x.lp", true));
        assertThrows(ConfigurationException.class, () -> FolderScanner.instanceName("README", false));
    }

    @Test
    void walksSubdirectoriesInNameOrder() {
        Path root = BtoolTestSupport.tempDir();
        try {
            BtoolTestSupport.touch(root, "b.lp", "a.lp", "sub/c.lp", ".svn/entries.lp", "skip/d.lp");

            var seen = new ArrayList<String>();
            FolderScanner.scan(root, false, List.of(Path.of("skip")), (dir, name, files) -> seen.add(dir + ":" + name));

            assertEquals(List.of(".:a", ".:b", "sub:c"), seen);
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void groupingMergesFilesSharingTheirFirstNameComponent() {
        Path root = BtoolTestSupport.tempDir();
        try {
            BtoolTestSupport.touch(root, "g.2.lp", "g.1.lp", "h.lp");

            var groups = new ArrayList<List<Path>>();
            FolderScanner.scan(root, true, List.of(), (dir, name, files) -> groups.add(files));

            assertEquals(2, groups.size());
            assertEquals(List.of(root.resolve("g.1.lp"), root.resolve("g.2.lp")), groups.get(0));
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }

    @Test
    void missingFoldersAreFilesystemErrors() {
        Path root = BtoolTestSupport.tempDir();
        try {
            var error = assertThrows(
                ConfigurationException.class,
                () -> FolderScanner.scan(root.resolve("nope"), false, List.of(), (dir, name, files) -> {})
            );
            assertEquals(Diagnostic.Category.FILESYSTEM, error.category());
        } finally {
            BtoolTestSupport.deleteTree(root);
        }
    }
}
