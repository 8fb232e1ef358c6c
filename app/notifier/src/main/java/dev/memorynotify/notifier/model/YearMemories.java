package dev.memorynotify.notifier.model;

import java.util.List;

public record YearMemories(int images, int videos, List<PhotoAsset> assets) {

  public YearMemories {
    assets = List.copyOf(assets);
  }
}
