package quest.gekko.creatorstats.domain;

public record PlatformShare(String platform, double percentage) {}
