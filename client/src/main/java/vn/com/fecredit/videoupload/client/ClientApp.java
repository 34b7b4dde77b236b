package vn.com.fecredit.videoupload.client;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

public class ClientApp {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 0 || (args.length == 1 && args[0].equalsIgnoreCase("--help"))) {
            printHelp();
            return 0;
        }

        Map<String, String> params = parseArgs(args);

        if (!params.containsKey("filePath") || !params.containsKey("baseUrl") || !params.containsKey("username") || !params.containsKey("password")) {
            System.err.println("Error: Missing required arguments: filePath, baseUrl, username, password");
            printHelp();
            return 1;
        }

        try {
            Path filePath = Paths.get(params.get("filePath"));
            VideoUploadClient.Builder builder = new VideoUploadClient.Builder()
                    .baseUrl(params.get("baseUrl"))
                    .username(params.get("username"))
                    .password(params.get("password"))
                    .retryTimes(Integer.parseInt(params.getOrDefault("retryTimes", "2")))
                    .progressListener((index, received, total) ->
                            System.out.printf("Chunk %d acknowledged (%d/%d)%n", index, received, total));
            if (params.containsKey("chunkSize")) {
                builder.chunkSize(Integer.parseInt(params.get("chunkSize")));
            }
            VideoUploadClient client = builder.build();

            UploadResult result;
            if (params.containsKey("resumeToken")) {
                System.out.println("Resuming upload for file: " + filePath);
                result = client.resume(filePath, params.get("resumeToken"));
            } else {
                System.out.println("Starting upload for file: " + filePath);
                result = client.upload(filePath);
            }
            System.out.println("Upload completed successfully. Video ID: " + result.getVideoId());
            return 0;
        } catch (Exception e) {
            System.err.println("Upload failed: " + e.getMessage());
            if (e.getCause() != null) {
                System.err.println("Cause: " + e.getCause().getMessage());
            }
            return 1;
        }
    }

    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> params = new HashMap<>();
        for (String arg : args) {
            if (arg.startsWith("--")) {
                String[] parts = arg.substring(2).split("=", 2);
                if (parts.length == 2) {
                    params.put(parts[0], parts[1]);
                }
            }
        }
        return params;
    }

    private static void printHelp() {
        System.out.println("Usage: java -jar video-upload-client.jar [options]");
        System.out.println("Options:");
        System.out.println("  --filePath=<path>          : Required. Path to the video to upload.");
        System.out.println("  --baseUrl=<url>            : Required. The server's root URL (e.g., http://localhost:8080).");
        System.out.println("  --username=<user>          : Required. Username for authentication.");
        System.out.println("  --password=<pass>          : Required. Password for authentication.");
        System.out.println("  --chunkSize=<bytes>        : Optional. Chunk size to request (default: server default).");
        System.out.println("  --retryTimes=<num>         : Optional. Resends of a chunk after a retryable error (default: 2).");
        System.out.println("  --resumeToken=<token>      : Optional. Resume the upload session with this token.");
        System.out.println("  --help                     : Print this help message.");
    }
}
