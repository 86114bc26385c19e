package github.sarthakdev143.scene_compiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SceneCompilerApplication {

	public static void main(String[] args) {
		SpringApplication.run(SceneCompilerApplication.class, args);
		System.out.println("					                                  \r\n" + //
				"  ___________ ________/  |_|  |__ _____  |  | __ __| _/_______  __\r\n" + //
				" /  ___/\\__  \\\\_  __ \\   __\\  |  \\\\__  \\ |  |/ // __ |/ __ \\  \\/ /\r\n" + //
				" \\___ \\  / __ \\|  | \\/|  | |   Y  \\/ __ \\|    </ /_/ \\  ___/\\   / \r\n" + //
				"/____  >(____  /__|   |__| |___|  (____  /__|_ \\____ |\\___  >\\_/  \r\n" + //
				"     \\/      \\/                 \\/     \\/     \\/    \\/    \\/      ");
	}

}
