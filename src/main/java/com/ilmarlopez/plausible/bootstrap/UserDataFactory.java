package com.ilmarlopez.plausible.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awscdk.services.ec2.LinuxUserDataOptions;
import software.amazon.awscdk.services.ec2.MultipartBody;
import software.amazon.awscdk.services.ec2.MultipartUserData;
import software.amazon.awscdk.services.ec2.UserData;

public class UserDataFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(UserDataFactory.class);

    public static final String SHEBANG = "#!/bin/bash";
    public static final String SHELL_SCRIPT_CONTENT_TYPE = "text/x-shellscript; charset=\"utf-8\"";

    private UserDataFactory() {
    }

    public static UserData create(BootScript script, boolean multipart) {
        if (script.isEmpty()) {
            throw new IllegalArgumentException("Boot script has no steps");
        }
        var userData = UserData.forLinux(LinuxUserDataOptions.builder()
                .shebang(SHEBANG)
                .build());
        userData.addCommands(script.commands().toArray(new String[0]));
        if (!multipart) {
            LOGGER.debug("Using plain user data");
            return userData;
        }
        LOGGER.debug("Wrapping user data in a multipart document");
        var multipartUserData = new MultipartUserData();
        multipartUserData.addPart(MultipartBody.fromUserData(userData, SHELL_SCRIPT_CONTENT_TYPE));
        return multipartUserData;
    }
}
