package com.tanmi.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tanmi")
public class TanmiProperties {

    private Storage storage = new Storage();

    public String getHome() { return storage.home; }
    public String getWorkspaceDirName() { return storage.workspaceDirName; }

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }

    public static class Storage {
        /** Directory holding the global workspace index. */
        private String home = System.getProperty("user.home") + "/.tanmi-workspace";
        /** Directory created inside each project root to hold its workspaces. */
        private String workspaceDirName = ".tanmi-workspace";

        public String getHome() { return home; }
        public void setHome(String home) { this.home = home; }
        public String getWorkspaceDirName() { return workspaceDirName; }
        public void setWorkspaceDirName(String workspaceDirName) { this.workspaceDirName = workspaceDirName; }
    }
}
