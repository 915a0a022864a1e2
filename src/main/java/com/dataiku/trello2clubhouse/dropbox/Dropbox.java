package com.dataiku.trello2clubhouse.dropbox;

import java.io.IOException;
import java.util.List;

public interface Dropbox {

    FileMetadata upload(UploadInput input) throws IOException;

    List<SharedLink> listSharedLinks(String path) throws IOException;

    SharedLink createSharedLink(String path) throws IOException;
}
