// src/main/java/app/Main.java
package app;

import tools.SimRun;

public class Main {
    public static void main(String[] args) {
        SimRun.main(args);
    }
}
