package com.crewdesk.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "crewdesk")
public class CrewdeskProperties {

    private String home = System.getProperty("user.home") + "/.crewdesk";
    private Health health = new Health();
    private Retention retention = new Retention();
    private Backend backend = new Backend();
    private Team team = new Team();
    private Budget budget = new Budget();
    private Skills skills = new Skills();
    private Broadcast broadcast = new Broadcast();

    public Path homePath() { return Path.of(home); }

    // -- delegate accessors --
    public int getInactivityTimeoutSeconds() { return health.inactivityTimeoutSeconds; }
    public int getSpecialistTimeoutSeconds() { return team.specialistTimeoutSeconds; }
    public int getTotalTimeoutSeconds() { return team.totalTimeoutSeconds; }
    public int getMaxSpecialists() { return team.maxSpecialists; }
    public boolean isTeamMode() { return team.teamMode; }

    public String getHome() { return home; }
    public void setHome(String home) { this.home = home; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
    public Retention getRetention() { return retention; }
    public void setRetention(Retention retention) { this.retention = retention; }
    public Backend getBackend() { return backend; }
    public void setBackend(Backend backend) { this.backend = backend; }
    public Team getTeam() { return team; }
    public void setTeam(Team team) { this.team = team; }
    public Budget getBudget() { return budget; }
    public void setBudget(Budget budget) { this.budget = budget; }
    public Skills getSkills() { return skills; }
    public void setSkills(Skills skills) { this.skills = skills; }
    public Broadcast getBroadcast() { return broadcast; }
    public void setBroadcast(Broadcast broadcast) { this.broadcast = broadcast; }

    public static class Health {
        private int inactivityTimeoutSeconds = 300;

        public int getInactivityTimeoutSeconds() { return inactivityTimeoutSeconds; }
        public void setInactivityTimeoutSeconds(int inactivityTimeoutSeconds) { this.inactivityTimeoutSeconds = inactivityTimeoutSeconds; }
    }

    public static class Retention {
        private int maxAgeDays = 90;

        public int getMaxAgeDays() { return maxAgeDays; }
        public void setMaxAgeDays(int maxAgeDays) { this.maxAgeDays = maxAgeDays; }
    }

    public static class Backend {
        /** "cli" shells out to an agent CLI, "chat" uses the Spring AI chat model. */
        private String type = "cli";
        private String command = "claude";
        private String analyzerModel = "sonnet";
        private String teamModel = "opus";
        private int analyzerTimeoutSeconds = 60;
        private List<String> extraArgs = new ArrayList<>();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getAnalyzerModel() { return analyzerModel; }
        public void setAnalyzerModel(String analyzerModel) { this.analyzerModel = analyzerModel; }
        public String getTeamModel() { return teamModel; }
        public void setTeamModel(String teamModel) { this.teamModel = teamModel; }
        public int getAnalyzerTimeoutSeconds() { return analyzerTimeoutSeconds; }
        public void setAnalyzerTimeoutSeconds(int analyzerTimeoutSeconds) { this.analyzerTimeoutSeconds = analyzerTimeoutSeconds; }
        public List<String> getExtraArgs() { return extraArgs; }
        public void setExtraArgs(List<String> extraArgs) { this.extraArgs = extraArgs; }
    }

    public static class Team {
        private int specialistTimeoutSeconds = 300;
        private int totalTimeoutSeconds = 600;
        private int maxSpecialists = 4;
        private long monitorPollMillis = 1000;
        private boolean teamMode = true;

        public int getSpecialistTimeoutSeconds() { return specialistTimeoutSeconds; }
        public void setSpecialistTimeoutSeconds(int specialistTimeoutSeconds) { this.specialistTimeoutSeconds = specialistTimeoutSeconds; }
        public int getTotalTimeoutSeconds() { return totalTimeoutSeconds; }
        public void setTotalTimeoutSeconds(int totalTimeoutSeconds) { this.totalTimeoutSeconds = totalTimeoutSeconds; }
        public int getMaxSpecialists() { return maxSpecialists; }
        public void setMaxSpecialists(int maxSpecialists) { this.maxSpecialists = maxSpecialists; }
        public long getMonitorPollMillis() { return monitorPollMillis; }
        public void setMonitorPollMillis(long monitorPollMillis) { this.monitorPollMillis = monitorPollMillis; }
        public boolean isTeamMode() { return teamMode; }
        public void setTeamMode(boolean teamMode) { this.teamMode = teamMode; }
    }

    public static class Budget {
        private double perTaskMaxUsd = 5.00;
        private double monthlyMaxUsd = 100.00;
        /** Blended USD per token; null keeps the built-in rate. */
        private Double pricePerToken;

        public double getPerTaskMaxUsd() { return perTaskMaxUsd; }
        public void setPerTaskMaxUsd(double perTaskMaxUsd) { this.perTaskMaxUsd = perTaskMaxUsd; }
        public double getMonthlyMaxUsd() { return monthlyMaxUsd; }
        public void setMonthlyMaxUsd(double monthlyMaxUsd) { this.monthlyMaxUsd = monthlyMaxUsd; }
        public Double getPricePerToken() { return pricePerToken; }
        public void setPricePerToken(Double pricePerToken) { this.pricePerToken = pricePerToken; }
    }

    public static class Skills {
        private String pluginsPath = "";

        public String getPluginsPath() { return pluginsPath; }
        public void setPluginsPath(String pluginsPath) { this.pluginsPath = pluginsPath; }
    }

    public static class Broadcast {
        private String url = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }
}
