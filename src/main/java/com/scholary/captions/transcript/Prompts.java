package com.scholary.captions.transcript;

import com.scholary.captions.chunking.Chunk;
import com.scholary.captions.config.CaptionProperties.TimingProperties;
import java.util.Locale;

/** Instructions sent to the audio understanding service. */
final class Prompts {

  private Prompts() {}

  static String chunkTranscription(Chunk chunk) {
    return String.format(
            Locale.ROOT,
            "Transcribe this audio for captioning, with accurate timestamps.\n"
                + "The clip starts at %.2f seconds in the original recording and is %.2f seconds"
                + " long.\n\n",
            chunk.start(),
            chunk.duration())
        + overlapNote(chunk)
        + "Besides speech, identify:\n"
        + "- Music: describe the style or mood, e.g. \"Upbeat jazz\"\n"
        + "- Sound effects: describe important sounds, e.g. \"Door slamming\"\n"
        + "- Silence that matters in context, e.g. \"Tense silence\"\n\n"
        + "Keep each caption self-contained and split long sentences at natural breaks.\n\n"
        + "Return only a JSON array. Each element has:\n"
        + "- \"text\": the spoken words, or a short description for non-speech\n"
        + "- \"start\": start time in seconds, relative to the start of this clip\n"
        + "- \"end\": end time in seconds, relative to the start of this clip\n"
        + "- \"type\": \"speech\", \"music\", \"sound\" or \"silence\"\n\n"
        + "Example:\n"
        + "[\n"
        + "  {\"text\": \"This is the first caption\", \"start\": 0.0, \"end\": 2.5,"
        + " \"type\": \"speech\"},\n"
        + "  {\"text\": \"Upbeat music\", \"start\": 2.5, \"end\": 5.0, \"type\": \"music\"},\n"
        + "  {\"text\": \"Door slamming\", \"start\": 5.0, \"end\": 5.5, \"type\": \"sound\"}\n"
        + "]\n\n"
        + "Mark speech you cannot make out as \"[unintelligible]\".\n";
  }

  private static String overlapNote(Chunk chunk) {
    if (!chunk.hasOverlap()) {
      return "";
    }
    return String.format(
        Locale.ROOT,
        "The last %.2f seconds are repeated at the start of the next clip. Caption them anyway.\n\n",
        chunk.end() - chunk.nominalEnd());
  }

  static String gapClassification(Gap gap) {
    return String.format(
            Locale.ROOT,
            "This audio is the stretch between %.2f s and %.2f s of a recording where no speech"
                + " was found.\n",
            gap.start(),
            gap.end())
        + "Decide whether it contains music, sound effects or ambient noise, or meaningful"
        + " silence.\n\n"
        + "Return only a JSON object:\n"
        + "- \"type\": \"music\", \"sound\" or \"silence\"\n"
        + "- \"text\": a short description of what you hear\n\n"
        + "Examples:\n"
        + "{\"type\": \"music\", \"text\": \"Suspenseful music\"}\n"
        + "{\"type\": \"sound\", \"text\": \"Footsteps approaching\"}\n"
        + "{\"type\": \"silence\", \"text\": \"Tense silence\"}\n\n"
        + "If there is nothing meaningful, return {\"type\": \"silence\", \"text\": \"Silence\"}.\n";
  }

  static String timingOptimization(String segmentsJson, TimingProperties rules) {
    return "These caption segments for a video need timing optimization so viewers can read"
        + " them.\n\n"
        + segmentsJson
        + "\n\n"
        + String.format(
            Locale.ROOT,
            "Adjust start and end times following these rules:\n"
                + "1. Every caption stays on screen for at least %.1f seconds where the next"
                + " caption allows.\n"
                + "2. Reading speed stays below %.0f characters per second.\n"
                + "3. Leave at least %.2f seconds between consecutive captions.\n",
            rules.minDurationSeconds(),
            rules.maxCharsPerSecond(),
            rules.minGapSeconds())
        + "4. Combine very short speech segments that belong to the same sentence, joining their"
        + " text in order.\n"
        + "5. Music and sound captions get plausible durations; a short sound is not stretched"
        + " over a long quiet stretch.\n"
        + "6. Keep the original order, never overlap captions, and never change or drop text.\n\n"
        + "Return only a JSON array with the same fields: \"text\", \"start\", \"end\", \"type\"."
        + " Times are absolute seconds.\n";
  }
}
